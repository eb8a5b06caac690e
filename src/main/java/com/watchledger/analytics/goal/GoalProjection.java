package com.watchledger.analytics.goal;

import java.math.BigDecimal;
import java.util.List;

/**
 * Progress toward the annual profit target as of a reference date.
 * progressPercentage is capped at 100; overshoot shows as remainingAmount reaching zero.
 */
public record GoalProjection(
        int year,
        BigDecimal goalAmount,
        BigDecimal currentYearProfit,
        BigDecimal progressPercentage,
        BigDecimal remainingAmount,
        int daysLeftInYear,
        BigDecimal dailyTargetNeeded,
        boolean isOnTrack,
        BigDecimal projectedEndAmount,
        List<MonthlyGoalProgress> monthlyBreakdown
) {

    public GoalProjection {
        monthlyBreakdown = monthlyBreakdown == null ? List.of() : List.copyOf(monthlyBreakdown);
    }
}
