package com.studytrack.badges.service;

import com.studytrack.badges.badge.ActivityStats;
import com.studytrack.badges.entity.StudySession;
import com.studytrack.badges.store.BadgeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 学习统计聚合：会话数、总分钟数、最长连续天数、单日最长学习时间、平均效率。
 * 纯读取，无副作用。
 * <p>
 * created_at 按 UTC 存储；"活跃日"和"今天"都按 clock 所在时区 (badges.zone-id) 的日历日划分。
 */
@Service
public class ActivityStatsServiceImpl implements ActivityStatsService {

    private static final Logger log = LoggerFactory.getLogger(ActivityStatsServiceImpl.class);

    private final BadgeStore badgeStore;
    private final Clock clock;

    public ActivityStatsServiceImpl(BadgeStore badgeStore, Clock clock) {
        this.badgeStore = badgeStore;
        this.clock = clock;
    }

    @Override
    public ActivityStats computeStats(UUID userId) {
        List<StudySession> sessions = badgeStore.findSessionsByUser(userId);
        if (sessions.isEmpty()) {
            return ActivityStats.empty();
        }

        long totalMinutes = 0;
        BigDecimal efficiencySum = BigDecimal.ZERO;
        int efficiencySamples = 0;
        // 活跃日 -> 当天累计分钟数（TreeMap 保证日期有序）
        Map<LocalDate, Long> minutesByDay = new TreeMap<>();

        for (StudySession session : sessions) {
            long minutes = session.getDurationMinutes() == null ? 0 : session.getDurationMinutes();
            totalMinutes += minutes;
            if (session.getCreatedAt() != null) {
                minutesByDay.merge(toLocalDay(session.getCreatedAt()), minutes, Long::sum);
            }
            // 没有效率记录的会话不参与平均，也不按 0 计
            if (session.getEfficiency() != null) {
                efficiencySum = efficiencySum.add(session.getEfficiency());
                efficiencySamples++;
            }
        }

        List<LocalDate> activeDays = new ArrayList<>(minutesByDay.keySet());
        long maxDailyMinutes = minutesByDay.values().stream().mapToLong(Long::longValue).max().orElse(0);
        // 不在这里截断小数位：阈值比较必须基于真实平均值，展示时再取整
        BigDecimal meanEfficiency = efficiencySamples == 0 ? null
                : efficiencySum.divide(BigDecimal.valueOf(efficiencySamples), MathContext.DECIMAL64);

        ActivityStats stats = new ActivityStats(
                sessions.size(),
                totalMinutes,
                longestStreak(activeDays),
                currentStreak(activeDays, LocalDate.now(clock)),
                maxDailyMinutes,
                meanEfficiency,
                efficiencySamples);
        log.debug("Computed stats for user {}: {}", userId, stats);
        return stats;
    }

    private LocalDate toLocalDay(LocalDateTime createdAtUtc) {
        return createdAtUtc.atOffset(ZoneOffset.UTC).atZoneSameInstant(clock.getZone()).toLocalDate();
    }

    /**
     * 最长的连续活跃天数，任何日历上的空档都会中断连续
     */
    static int longestStreak(List<LocalDate> sortedDays) {
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : sortedDays) {
            run = (previous != null && previous.plusDays(1).equals(day)) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return longest;
    }

    /**
     * 以今天或昨天结尾的连续活跃天数；最近一次活跃早于昨天则为 0
     */
    static int currentStreak(List<LocalDate> sortedDays, LocalDate today) {
        if (sortedDays.isEmpty()) {
            return 0;
        }
        LocalDate last = sortedDays.get(sortedDays.size() - 1);
        if (last.isBefore(today.minusDays(1))) {
            return 0;
        }
        int streak = 1;
        for (int i = sortedDays.size() - 1; i > 0; i--) {
            if (!sortedDays.get(i - 1).plusDays(1).equals(sortedDays.get(i))) {
                break;
            }
            streak++;
        }
        return streak;
    }
}
