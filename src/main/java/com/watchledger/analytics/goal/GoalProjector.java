package com.watchledger.analytics.goal;

import com.watchledger.analytics.metrics.AnnotatedWatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Annual profit goal tracking. The reference date is always passed in, never read from the system clock,
 * so the projection is deterministic for a given input.
 */
@Component
public class GoalProjector {

    public static final BigDecimal DEFAULT_TARGET = new BigDecimal("100000");

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    public GoalProjection projectGoal(List<AnnotatedWatch> watches, LocalDate referenceDate) {
        return projectGoal(watches, DEFAULT_TARGET, referenceDate);
    }

    /**
     * Projects progress for the calendar year of referenceDate.
     * <ul>
     *   <li>daysLeftInYear counts from referenceDate (inclusive) to 1 January of the next year.</li>
     *   <li>dailyTargetNeeded divides the remainder by at least one day.</li>
     *   <li>isOnTrack compares the pace achieved so far (profit per elapsed day) against the pace needed from
     *       1 January to reach the target by year end.</li>
     * </ul>
     */
    public GoalProjection projectGoal(List<AnnotatedWatch> watches, BigDecimal target, LocalDate referenceDate) {
        if (target == null || target.signum() <= 0) {
            throw new IllegalArgumentException("Goal target must be positive, got: " + target);
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate must not be null");
        }
        int year = referenceDate.getYear();
        BigDecimal[] monthlyActual = new BigDecimal[12];
        Arrays.fill(monthlyActual, BigDecimal.ZERO);
        BigDecimal currentYearProfit = BigDecimal.ZERO;
        if (watches != null) {
            for (AnnotatedWatch w : watches) {
                if (!w.watch().isSoldWithCostBasis() || w.watch().dateSold().getYear() != year) {
                    continue;
                }
                currentYearProfit = currentYearProfit.add(w.netProfit());
                int m = w.watch().dateSold().getMonthValue() - 1;
                monthlyActual[m] = monthlyActual[m].add(w.netProfit());
            }
        }

        BigDecimal progress = currentYearProfit.multiply(HUNDRED).divide(target, SCALE, ROUNDING).min(HUNDRED);
        BigDecimal remaining = target.subtract(currentYearProfit).max(BigDecimal.ZERO);

        LocalDate startOfYear = LocalDate.of(year, 1, 1);
        LocalDate startOfNextYear = startOfYear.plusYears(1);
        int daysInYear = referenceDate.lengthOfYear();
        int daysLeft = (int) Math.max(0, ChronoUnit.DAYS.between(referenceDate, startOfNextYear));
        int daysElapsed = (int) ChronoUnit.DAYS.between(startOfYear, referenceDate);

        BigDecimal dailyTarget = remaining.divide(BigDecimal.valueOf(Math.max(1, daysLeft)), SCALE, ROUNDING);

        // profit / elapsed >= target / daysInYear, cross-multiplied to stay exact
        boolean onTrack = currentYearProfit.multiply(BigDecimal.valueOf(daysInYear))
                .compareTo(target.multiply(BigDecimal.valueOf(Math.max(1, daysElapsed)))) >= 0;

        BigDecimal projectedEnd = daysElapsed > 0
                ? currentYearProfit.multiply(BigDecimal.valueOf(daysInYear))
                        .divide(BigDecimal.valueOf(daysElapsed), SCALE, ROUNDING)
                : currentYearProfit;

        return new GoalProjection(
                year,
                target,
                currentYearProfit,
                progress,
                remaining,
                daysLeft,
                dailyTarget,
                onTrack,
                projectedEnd,
                monthlyBreakdown(year, target, monthlyActual, referenceDate));
    }

    private static List<MonthlyGoalProgress> monthlyBreakdown(int year, BigDecimal target, BigDecimal[] actual,
                                                              LocalDate referenceDate) {
        BigDecimal monthlyTarget = target.divide(MONTHS_PER_YEAR, SCALE, ROUNDING);
        List<MonthlyGoalProgress> out = new ArrayList<>(12);
        for (Month month : Month.values()) {
            LocalDate monthEnd = YearMonth.of(year, month).atEndOfMonth();
            out.add(new MonthlyGoalProgress(
                    month.getDisplayName(TextStyle.SHORT, Locale.US),
                    monthlyTarget,
                    actual[month.getValue() - 1],
                    monthEnd.isBefore(referenceDate)));
        }
        return out;
    }
}
