package com.studytrack.badges.badge;

import com.studytrack.badges.dto.BadgeProgressDTO;
import com.studytrack.badges.entity.Badge;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 判断一份统计快照是否满足某个徽章的规则。
 * 所有比较都是包含式的（>=）：恰好达到阈值即视为满足。
 */
@Component
public class RequirementEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ALMOST_COMPLETE = new BigDecimal("99.9");

    /**
     * @throws com.studytrack.badges.exception.UnknownRequirementKindException 目录中的规则类型无法识别
     */
    public boolean isSatisfied(ActivityStats stats, Badge badge) {
        RequirementType type = RequirementType.fromCode(badge.getRequirementType());
        BigDecimal current = currentValue(stats, type);
        // 没有任何效率记录时，效率类徽章视为"尚未满足"而不是错误
        return current != null && current.compareTo(badge.getRequirementValue()) >= 0;
    }

    /**
     * 计算用户朝某个徽章的进度
     */
    public BadgeProgressDTO progress(ActivityStats stats, Badge badge) {
        RequirementType type = RequirementType.fromCode(badge.getRequirementType());
        BigDecimal target = badge.getRequirementValue();
        BigDecimal current = currentValue(stats, type);
        if (current == null) {
            current = BigDecimal.ZERO;
        }

        BigDecimal percentage;
        if (target.signum() <= 0) {
            percentage = HUNDRED;
        } else {
            percentage = current.multiply(HUNDRED).divide(target, 1, RoundingMode.HALF_UP).min(HUNDRED);
        }

        boolean complete = isSatisfied(stats, badge);
        // 四舍五入后可能显示 100.0，但未达标时不能显示为已完成
        if (!complete && percentage.compareTo(HUNDRED) >= 0) {
            percentage = ALMOST_COMPLETE;
        }

        BadgeProgressDTO dto = new BadgeProgressDTO();
        // 平均效率保留全部精度用于比较，展示时取两位小数
        dto.setCurrent(current.scale() > 2 ? current.setScale(2, RoundingMode.HALF_UP) : current);
        dto.setTarget(target);
        dto.setPercentage(percentage.setScale(1, RoundingMode.HALF_UP));
        dto.setComplete(complete);
        return dto;
    }

    private BigDecimal currentValue(ActivityStats stats, RequirementType type) {
        return switch (type) {
            case TOTAL_SESSIONS -> BigDecimal.valueOf(stats.sessionCount());
            case TOTAL_MINUTES -> BigDecimal.valueOf(stats.totalMinutes());
            case STREAK_DAYS -> BigDecimal.valueOf(stats.longestStreakDays());
            case DAILY_MINUTES -> BigDecimal.valueOf(stats.maxDailyMinutes());
            case EFFICIENCY_THRESHOLD -> stats.hasEfficiency() ? stats.meanEfficiency() : null;
        };
    }
}
