package com.studytrack.badges.store;

import com.studytrack.badges.entity.Badge;
import com.studytrack.badges.entity.StudySession;
import com.studytrack.badges.entity.StudyUser;
import com.studytrack.badges.entity.UserBadge;
import com.studytrack.badges.exception.DataUnavailableException;
import com.studytrack.badges.exception.PersistenceFailureException;
import com.studytrack.badges.repository.BadgeRepository;
import com.studytrack.badges.repository.StudySessionRepository;
import com.studytrack.badges.repository.StudyUserRepository;
import com.studytrack.badges.repository.UserBadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 基于 Spring Data JPA 的 BadgeStore 实现。
 * 负责把数据访问异常翻译成引擎的错误分类。
 */
@Component
public class JpaBadgeStore implements BadgeStore {

    private static final Logger log = LoggerFactory.getLogger(JpaBadgeStore.class);

    private final StudySessionRepository sessionRepository;
    private final BadgeRepository badgeRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final StudyUserRepository userRepository;

    public JpaBadgeStore(StudySessionRepository sessionRepository,
                         BadgeRepository badgeRepository,
                         UserBadgeRepository userBadgeRepository,
                         StudyUserRepository userRepository) {
        this.sessionRepository = sessionRepository;
        this.badgeRepository = badgeRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.userRepository = userRepository;
    }

    @Override
    public List<StudySession> findSessionsByUser(UUID userId) {
        return read("study sessions of user " + userId,
                () -> sessionRepository.findByUserIdOrderByCreatedAtAsc(userId));
    }

    @Override
    public List<Badge> findCatalog() {
        return read("badge catalog", badgeRepository::findAllByOrderByDisplayOrderAscIdAsc);
    }

    @Override
    public List<UserBadge> findAwardsByUser(UUID userId) {
        return read("badges of user " + userId, () -> userBadgeRepository.findByUserId(userId));
    }

    @Override
    public Map<UUID, Long> countAwardsByUser() {
        List<Object[]> rows = read("badge counts", userBadgeRepository::countBadgesGroupByUser);
        Map<UUID, Long> counts = new HashMap<>(rows.size());
        for (Object[] row : rows) {
            // 索引 0: user_id, 索引 1: COUNT (Long)
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    public boolean insertAwardIfAbsent(UUID userId, String badgeId, LocalDateTime achievedAt) {
        try {
            // saveAndFlush 立即执行 INSERT，唯一约束冲突在这里就会暴露
            userBadgeRepository.saveAndFlush(new UserBadge(userId, badgeId, achievedAt));
            return true;
        } catch (DataIntegrityViolationException e) {
            // 只有 (user_id, badge_id) 已存在才算"已颁发"；其余约束失败按写入失败处理
            if (awardExists(userId, badgeId, e)) {
                log.debug("Badge {} already awarded to user {}, insert skipped", badgeId, userId);
                return false;
            }
            throw new PersistenceFailureException(
                    "Failed to award badge " + badgeId + " to user " + userId + ": constraint violation", e);
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceFailureException(
                    "Failed to award badge " + badgeId + " to user " + userId, e);
        }
    }

    private boolean awardExists(UUID userId, String badgeId, DataIntegrityViolationException violation) {
        try {
            return userBadgeRepository.existsByUserIdAndBadgeId(userId, badgeId);
        } catch (DataAccessException | TransactionException e) {
            e.addSuppressed(violation);
            throw new PersistenceFailureException(
                    "Failed to verify award of badge " + badgeId + " to user " + userId, e);
        }
    }

    @Override
    public Map<UUID, String> findUsernames(Collection<UUID> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        List<StudyUser> users = read("usernames", () -> userRepository.findAllById(userIds));
        Map<UUID, String> names = new HashMap<>(users.size());
        users.forEach(u -> names.put(u.getId(), u.getUsername()));
        return names;
    }

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException e) {
            throw new DataUnavailableException("Failed to read " + what, e);
        }
    }
}
