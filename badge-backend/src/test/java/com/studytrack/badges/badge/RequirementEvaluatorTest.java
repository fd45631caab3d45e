package com.studytrack.badges.badge;

import com.studytrack.badges.dto.BadgeProgressDTO;
import com.studytrack.badges.entity.Badge;
import com.studytrack.badges.exception.UnknownRequirementKindException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class RequirementEvaluatorTest {

    private final RequirementEvaluator evaluator = new RequirementEvaluator();

    @Test
    void testIsSatisfied_TotalSessions_Inclusive() {
        Badge badge = badge("total_sessions", "5");

        assertFalse(evaluator.isSatisfied(stats(4, 0, 0, 0, null), badge));
        assertTrue(evaluator.isSatisfied(stats(5, 0, 0, 0, null), badge)); // 恰好达到阈值
        assertTrue(evaluator.isSatisfied(stats(6, 0, 0, 0, null), badge));
    }

    @Test
    void testIsSatisfied_TotalMinutes() {
        Badge badge = badge("total_minutes", "600");

        assertFalse(evaluator.isSatisfied(stats(3, 599, 0, 0, null), badge));
        assertTrue(evaluator.isSatisfied(stats(3, 600, 0, 0, null), badge));
    }

    @Test
    void testIsSatisfied_StreakDays() {
        Badge badge = badge("streak_days", "7");

        assertFalse(evaluator.isSatisfied(stats(10, 0, 6, 0, null), badge));
        assertTrue(evaluator.isSatisfied(stats(10, 0, 7, 0, null), badge));
    }

    @Test
    void testIsSatisfied_DailyMinutes() {
        Badge badge = badge("daily_minutes", "600");

        assertFalse(evaluator.isSatisfied(stats(2, 900, 0, 599, null), badge));
        assertTrue(evaluator.isSatisfied(stats(2, 900, 0, 600, null), badge));
    }

    @Test
    void testIsSatisfied_Efficiency() {
        Badge badge = badge("efficiency_threshold", "85.5");

        assertFalse(evaluator.isSatisfied(stats(3, 0, 0, 0, new BigDecimal("85.49")), badge));
        assertTrue(evaluator.isSatisfied(stats(3, 0, 0, 0, new BigDecimal("85.50")), badge));
    }

    // 没有效率记录时视为未满足，而不是报错
    @Test
    void testIsSatisfied_Efficiency_NoSamples() {
        Badge badge = badge("efficiency_threshold", "0");

        assertFalse(evaluator.isSatisfied(stats(3, 100, 1, 100, null), badge));
    }

    @Test
    void testIsSatisfied_UnknownKindSurfaces() {
        Badge badge = badge("spaces_joined", "5");

        assertThrows(UnknownRequirementKindException.class,
                () -> evaluator.isSatisfied(stats(100, 100, 100, 100, BigDecimal.TEN), badge));
    }

    // 单调性：满足条件的统计，各项都不减少时仍然满足
    @Test
    void testIsSatisfied_Monotonic() {
        Badge[] badges = {
                badge("total_sessions", "5"),
                badge("total_minutes", "300"),
                badge("streak_days", "3"),
                badge("daily_minutes", "120"),
                badge("efficiency_threshold", "70")
        };
        ActivityStats base = stats(5, 300, 3, 120, new BigDecimal("70.00"));
        ActivityStats[] larger = {
                stats(5, 300, 3, 120, new BigDecimal("70.00")),
                stats(6, 300, 3, 120, new BigDecimal("70.00")),
                stats(5, 301, 4, 121, new BigDecimal("70.01")),
                stats(50, 3000, 30, 1200, new BigDecimal("99.99"))
        };

        for (Badge badge : badges) {
            assertTrue(evaluator.isSatisfied(base, badge), badge.getRequirementType());
            for (ActivityStats s : larger) {
                assertTrue(evaluator.isSatisfied(s, badge), badge.getRequirementType() + " " + s);
            }
        }
    }

    @Test
    void testProgress_PartialAndCapped() {
        Badge sessions = badge("total_sessions", "50");

        BadgeProgressDTO partial = evaluator.progress(stats(12, 0, 0, 0, null), sessions);
        assertEquals(0, new BigDecimal("12").compareTo(partial.getCurrent()));
        assertEquals(0, new BigDecimal("50").compareTo(partial.getTarget()));
        assertEquals(new BigDecimal("24.0"), partial.getPercentage());
        assertFalse(partial.getComplete());

        BadgeProgressDTO capped = evaluator.progress(stats(80, 0, 0, 0, null), sessions);
        assertEquals(new BigDecimal("100.0"), capped.getPercentage());
        assertTrue(capped.getComplete());
    }

    // 84.995 显示为 85.00 / 99.9%，但不算完成
    @Test
    void testProgress_EfficiencyJustBelowThreshold() {
        ActivityStats stats = new ActivityStats(2, 60, 1, 0, 60, new BigDecimal("84.995"), 2);
        Badge badge = badge("efficiency_threshold", "85");

        BadgeProgressDTO progress = evaluator.progress(stats, badge);

        assertFalse(evaluator.isSatisfied(stats, badge));
        assertEquals(new BigDecimal("85.00"), progress.getCurrent());
        assertEquals(new BigDecimal("99.9"), progress.getPercentage());
        assertFalse(progress.getComplete());
    }

    @Test
    void testProgress_EfficiencyWithoutSamples() {
        BadgeProgressDTO progress = evaluator.progress(stats(2, 60, 1, 60, null), badge("efficiency_threshold", "80"));

        assertEquals(0, BigDecimal.ZERO.compareTo(progress.getCurrent()));
        assertEquals(new BigDecimal("0.0"), progress.getPercentage());
        assertFalse(progress.getComplete());
    }

    private static ActivityStats stats(long sessions, long minutes, int longestStreak,
                                       long maxDaily, BigDecimal efficiency) {
        return new ActivityStats(sessions, minutes, longestStreak, 0, maxDaily,
                efficiency, efficiency == null ? 0 : 1);
    }

    private static Badge badge(String type, String value) {
        Badge badge = new Badge();
        badge.setId(type + "_" + value);
        badge.setTitle(type);
        badge.setCategory("test");
        badge.setRequirementType(type);
        badge.setRequirementValue(new BigDecimal(value));
        badge.setDisplayOrder(1);
        return badge;
    }
}
