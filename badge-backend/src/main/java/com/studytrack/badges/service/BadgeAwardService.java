package com.studytrack.badges.service;

import com.studytrack.badges.badge.ActivityStats;
import com.studytrack.badges.badge.RequirementEvaluator;
import com.studytrack.badges.dto.BadgeAwardResultDTO;
import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.entity.Badge;
import com.studytrack.badges.entity.UserBadge;
import com.studytrack.badges.exception.PersistenceFailureException;
import com.studytrack.badges.store.BadgeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 徽章检测颁发服务：对用户尚未获得的徽章逐个评估，并把新达成的徽章写入 user_badges。
 * <p>
 * 本服务不加锁，也不包裹在单个事务里：每条插入各自提交，
 * (user_id, badge_id) 唯一约束是并发调用之间唯一的仲裁者。
 * 输掉竞争的一方看到"已存在"，只是不把该徽章计入本次结果。
 */
@Service
public class BadgeAwardService {

    private static final Logger log = LoggerFactory.getLogger(BadgeAwardService.class);

    private final BadgeStore badgeStore;
    private final ActivityStatsService activityStatsService;
    private final RequirementEvaluator requirementEvaluator;
    private final Clock clock;

    public BadgeAwardService(BadgeStore badgeStore,
                             ActivityStatsService activityStatsService,
                             RequirementEvaluator requirementEvaluator,
                             Clock clock) {
        this.badgeStore = badgeStore;
        this.activityStatsService = activityStatsService;
        this.requirementEvaluator = requirementEvaluator;
        this.clock = clock;
    }

    /**
     * 执行一次检测并持久化新达成的徽章。
     *
     * @return 本次调用新颁发的徽章（按目录顺序）以及写入失败的徽章 ID
     * @throws PersistenceFailureException 所有尝试的写入都失败
     */
    public BadgeAwardResultDTO checkAndAward(UUID userId) {
        long startTime = System.currentTimeMillis();

        // 1. 已获得的徽章
        Set<String> earned = badgeStore.findAwardsByUser(userId).stream()
                .map(UserBadge::getBadgeId)
                .collect(Collectors.toSet());

        // 2. 候选 = 目录 - 已获得，保持目录的自然顺序
        List<Badge> candidates = badgeStore.findCatalog().stream()
                .filter(b -> !earned.contains(b.getId()))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            log.debug("User {} already holds every badge ({}), nothing to check", userId, earned.size());
            return BadgeAwardResultDTO.none();
        }

        // 3. 统计只计算一次，对所有候选复用
        ActivityStats stats = activityStatsService.computeStats(userId);

        List<BadgeDTO> newBadges = new ArrayList<>();
        List<String> failedBadgeIds = new ArrayList<>();
        int attempted = 0;
        int alreadyPresent = 0;
        // achieved_at 与 created_at 一样按 UTC 存储
        LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));

        for (Badge badge : candidates) {
            if (!requirementEvaluator.isSatisfied(stats, badge)) {
                continue;
            }
            attempted++;
            try {
                if (badgeStore.insertAwardIfAbsent(userId, badge.getId(), now)) {
                    newBadges.add(BadgeDTO.from(badge));
                } else {
                    // 并发的另一次调用先写入了，本次不算新获得
                    alreadyPresent++;
                }
            } catch (PersistenceFailureException e) {
                log.warn("Failed to award badge {} to user {}: {}", badge.getId(), userId, e.getMessage());
                failedBadgeIds.add(badge.getId());
            }
        }

        if (attempted > 0 && failedBadgeIds.size() == attempted) {
            throw new PersistenceFailureException(
                    "Failed to persist any of " + attempted + " qualifying badges for user " + userId);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        if (!newBadges.isEmpty()) {
            log.info("Awarded {} new badges to user {}", newBadges.size(), userId);
        }
        log.debug("Badge check for user {} finished: candidates {}, qualified {}, new {}, already present {}, failed {}, {} ms",
                userId, candidates.size(), attempted, newBadges.size(), alreadyPresent, failedBadgeIds.size(), elapsed);

        return new BadgeAwardResultDTO(newBadges, failedBadgeIds);
    }
}
