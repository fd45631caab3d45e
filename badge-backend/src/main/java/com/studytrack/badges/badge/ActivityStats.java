package com.studytrack.badges.badge;

import java.math.BigDecimal;

/**
 * 单次评估使用的用户学习统计快照，每次评估重新计算，不缓存。
 *
 * @param meanEfficiency 有效率记录的平均值；没有任何记录时为 null
 */
public record ActivityStats(
    long sessionCount,
    long totalMinutes,
    int longestStreakDays,
    int currentStreakDays,
    long maxDailyMinutes,
    BigDecimal meanEfficiency,
    int efficiencySampleCount
) {

    public static ActivityStats empty() {
        return new ActivityStats(0, 0, 0, 0, 0, null, 0);
    }

    public boolean hasEfficiency() {
        return efficiencySampleCount > 0 && meanEfficiency != null;
    }
}
