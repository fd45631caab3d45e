package com.studytrack.badges.service;

import com.studytrack.badges.badge.ActivityStats;
import com.studytrack.badges.badge.RequirementEvaluator;
import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.dto.EarnedBadgeDTO;
import com.studytrack.badges.dto.UserBadgeProgressDTO;
import com.studytrack.badges.dto.UserBadgesDTO;
import com.studytrack.badges.entity.Badge;
import com.studytrack.badges.entity.UserBadge;
import com.studytrack.badges.store.BadgeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class BadgeQueryServiceImpl implements BadgeQueryService {

    private static final Logger log = LoggerFactory.getLogger(BadgeQueryServiceImpl.class);

    // 最新获得在前；同一时刻获得的按徽章 ID 排，保证输出稳定
    private static final Comparator<EarnedBadgeDTO> NEWEST_FIRST =
            Comparator.comparing(EarnedBadgeDTO::getAchievedAt, Comparator.reverseOrder())
                      .thenComparing(EarnedBadgeDTO::getBadgeId);

    private final BadgeStore badgeStore;
    private final ActivityStatsService activityStatsService;
    private final RequirementEvaluator requirementEvaluator;
    private final int recentWindow;

    public BadgeQueryServiceImpl(BadgeStore badgeStore,
                                 ActivityStatsService activityStatsService,
                                 RequirementEvaluator requirementEvaluator,
                                 @Value("${badges.recent-window:5}") int recentWindow) {
        this.badgeStore = badgeStore;
        this.activityStatsService = activityStatsService;
        this.requirementEvaluator = requirementEvaluator;
        this.recentWindow = recentWindow;
    }

    @Override
    public UserBadgesDTO getUserBadges(UUID userId) {
        List<UserBadge> awards = badgeStore.findAwardsByUser(userId);
        if (awards.isEmpty()) {
            // "还没有徽章"是正常结果，与"查询失败"区分
            return UserBadgesDTO.empty();
        }

        Map<String, Badge> catalog = catalogById();
        List<EarnedBadgeDTO> badges = new ArrayList<>(awards.size());
        for (UserBadge award : awards) {
            Badge badge = catalog.get(award.getBadgeId());
            if (badge == null) {
                log.warn("User {} holds badge {} which is missing from the catalog, skipped", userId, award.getBadgeId());
                continue;
            }
            badges.add(toEarned(award, badge));
        }
        badges.sort(NEWEST_FIRST);

        Map<String, Integer> categories = new TreeMap<>();
        badges.forEach(b -> categories.merge(b.getCategory(), 1, Integer::sum));

        List<EarnedBadgeDTO> recent = badges.size() > recentWindow
                ? new ArrayList<>(badges.subList(0, recentWindow))
                : new ArrayList<>(badges);

        return new UserBadgesDTO(badges, badges.size(), categories, recent);
    }

    @Override
    public List<BadgeDTO> getBadgeCatalog() {
        return badgeStore.findCatalog().stream()
                .map(BadgeDTO::from)
                .collect(Collectors.toList());
    }

    @Override
    public List<UserBadgeProgressDTO> getBadgeProgress(UUID userId) {
        List<Badge> catalog = badgeStore.findCatalog();
        Map<String, LocalDateTime> achieved = new HashMap<>();
        badgeStore.findAwardsByUser(userId).forEach(a -> achieved.put(a.getBadgeId(), a.getAchievedAt()));
        ActivityStats stats = activityStatsService.computeStats(userId);

        List<UserBadgeProgressDTO> result = new ArrayList<>(catalog.size());
        for (Badge badge : catalog) {
            UserBadgeProgressDTO dto = new UserBadgeProgressDTO();
            dto.setBadge(BadgeDTO.from(badge));
            dto.setEarned(achieved.containsKey(badge.getId()));
            dto.setAchievedAt(achieved.get(badge.getId()));
            dto.setProgress(requirementEvaluator.progress(stats, badge));
            result.add(dto);
        }
        return result;
    }

    private Map<String, Badge> catalogById() {
        return badgeStore.findCatalog().stream()
                .collect(Collectors.toMap(Badge::getId, Function.identity()));
    }

    private EarnedBadgeDTO toEarned(UserBadge award, Badge badge) {
        EarnedBadgeDTO dto = new EarnedBadgeDTO();
        dto.setId(award.getId());
        dto.setBadgeId(badge.getId());
        dto.setTitle(badge.getTitle());
        dto.setDescription(badge.getDescription());
        dto.setIcon(badge.getIcon());
        dto.setCategory(badge.getCategory());
        dto.setAchievedAt(award.getAchievedAt());
        return dto;
    }
}
