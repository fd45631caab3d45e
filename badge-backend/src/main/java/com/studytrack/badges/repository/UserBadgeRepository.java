package com.studytrack.badges.repository;

import com.studytrack.badges.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserBadgeRepository extends JpaRepository<UserBadge, Long> {

    List<UserBadge> findByUserId(UUID userId);

    boolean existsByUserIdAndBadgeId(UUID userId, String badgeId);

    /**
     * 按用户分组统计徽章数量（排行榜用）
     * 索引顺序: [0:user_id, 1:badge_count]
     */
    @Query("SELECT ub.userId, COUNT(ub) FROM UserBadge ub GROUP BY ub.userId")
    List<Object[]> countBadgesGroupByUser();
}
