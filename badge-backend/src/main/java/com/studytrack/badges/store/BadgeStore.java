package com.studytrack.badges.store;

import com.studytrack.badges.entity.Badge;
import com.studytrack.badges.entity.StudySession;
import com.studytrack.badges.entity.UserBadge;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 徽章引擎依赖的持久化操作。
 * <p>
 * 所有读操作失败时抛出 {@link com.studytrack.badges.exception.DataUnavailableException}；
 * 除唯一约束冲突以外的写失败抛出 {@link com.studytrack.badges.exception.PersistenceFailureException}。
 * 实现类必须保证 (userId, badgeId) 至多一条记录。
 */
public interface BadgeStore {

    List<StudySession> findSessionsByUser(UUID userId);

    /**
     * 完整的徽章目录，按自然顺序（display_order, id）返回
     */
    List<Badge> findCatalog();

    List<UserBadge> findAwardsByUser(UUID userId);

    /**
     * 所有拥有至少一枚徽章的用户及其徽章数
     */
    Map<UUID, Long> countAwardsByUser();

    /**
     * 插入一条颁发记录；若 (userId, badgeId) 已存在则什么都不做。
     *
     * @return true 表示本次调用新建了记录；false 表示记录已存在
     */
    boolean insertAwardIfAbsent(UUID userId, String badgeId, LocalDateTime achievedAt);

    /**
     * 查询用户昵称，找不到的用户不出现在返回值中
     */
    Map<UUID, String> findUsernames(Collection<UUID> userIds);
}
