package com.watchledger.analytics.goal;

import com.watchledger.analytics.metrics.AnnotatedWatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.watchledger.analytics.WatchFixtures.annotated;
import static com.watchledger.analytics.WatchFixtures.inStock;
import static com.watchledger.analytics.WatchFixtures.sold;
import static com.watchledger.analytics.WatchFixtures.soldWithProfit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoalProjectorTest {

    private static final LocalDate JULY_2 = LocalDate.parse("2024-07-02");

    private GoalProjector projector;

    @BeforeEach
    void setUp() {
        projector = new GoalProjector();
    }

    @Test
    @DisplayName("40000 of 100000 on 2 July: 40%, 60000 left over 183 days")
    void midYearProjection() {
        List<AnnotatedWatch> watches = annotated(
                soldWithProfit("a", "25000", "2024-02-10"),
                soldWithProfit("b", "15000", "2024-06-30"),
                soldWithProfit("old", "99999", "2023-11-01"));

        GoalProjection goal = projector.projectGoal(watches, JULY_2);

        assertThat(goal.year()).isEqualTo(2024);
        assertThat(goal.goalAmount()).isEqualByComparingTo("100000");
        assertThat(goal.currentYearProfit()).isEqualByComparingTo("40000");
        assertThat(goal.progressPercentage()).isEqualByComparingTo("40.0");
        assertThat(goal.remainingAmount()).isEqualByComparingTo("60000");
        assertThat(goal.daysLeftInYear()).isEqualTo(183);
        assertThat(goal.dailyTargetNeeded()).isEqualByComparingTo("327.87");
        assertThat(goal.isOnTrack()).isFalse();
    }

    @Test
    @DisplayName("progress never exceeds 100 and remaining never goes negative")
    void overshoot_isCapped() {
        GoalProjection goal = projector.projectGoal(annotated(soldWithProfit("a", "150000", "2024-03-01")), JULY_2);

        assertThat(goal.progressPercentage()).isEqualByComparingTo("100");
        assertThat(goal.remainingAmount()).isEqualByComparingTo("0");
        assertThat(goal.dailyTargetNeeded()).isEqualByComparingTo("0");
        assertThat(goal.isOnTrack()).isTrue();
    }

    @Test
    @DisplayName("on track compares achieved pace with required pace from 1 January")
    void onTrack_usesPace() {
        // 183 of 366 days elapsed: required 100000 * 183 / 366 = 50000 by now
        GoalProjection behind = projector.projectGoal(annotated(soldWithProfit("a", "49999", "2024-03-01")), JULY_2);
        GoalProjection ahead = projector.projectGoal(annotated(soldWithProfit("a", "50000", "2024-03-01")), JULY_2);

        assertThat(behind.isOnTrack()).isFalse();
        assertThat(ahead.isOnTrack()).isTrue();
    }

    @Test
    @DisplayName("last day of year still has one day left")
    void yearEnd_guardsDivision() {
        GoalProjection goal = projector.projectGoal(annotated(soldWithProfit("a", "10000", "2024-03-01")),
                LocalDate.parse("2024-12-31"));

        assertThat(goal.daysLeftInYear()).isEqualTo(1);
        assertThat(goal.dailyTargetNeeded()).isEqualByComparingTo("90000");
    }

    @Test
    @DisplayName("1 January: nothing elapsed, projection equals profit so far")
    void firstDayOfYear() {
        GoalProjection goal = projector.projectGoal(List.of(), LocalDate.parse("2025-01-01"));

        assertThat(goal.daysLeftInYear()).isEqualTo(365);
        assertThat(goal.currentYearProfit()).isEqualByComparingTo("0");
        assertThat(goal.projectedEndAmount()).isEqualByComparingTo("0");
        assertThat(goal.isOnTrack()).isFalse();
        assertThat(goal.dailyTargetNeeded()).isEqualByComparingTo("273.97");
    }

    @Test
    void excludesRecordsWithoutCostBasisOrUnsold() {
        List<AnnotatedWatch> watches = annotated(
                sold("a", "Rolex", null, "5000", null, "2024-03-01"),
                inStock("b", "Rolex", "5000", "2024-03-01"));

        assertThat(projector.projectGoal(watches, JULY_2).currentYearProfit()).isEqualByComparingTo("0");
    }

    @Test
    void projectedEndAmount_extrapolatesCurrentPace() {
        GoalProjection goal = projector.projectGoal(annotated(soldWithProfit("a", "40000", "2024-03-01")), JULY_2);

        // 40000 * 366 / 183
        assertThat(goal.projectedEndAmount()).isEqualByComparingTo("80000");
    }

    @Test
    void monthlyBreakdown_hasTwelveMonthsWithTargetAndActuals() {
        GoalProjection goal = projector.projectGoal(annotated(
                soldWithProfit("a", "1200", "2024-01-15"),
                soldWithProfit("b", "800", "2024-01-20"),
                soldWithProfit("c", "500", "2024-07-01")), JULY_2);

        assertThat(goal.monthlyBreakdown()).hasSize(12);
        assertThat(goal.monthlyBreakdown()).extracting(MonthlyGoalProgress::month)
                .startsWith("Jan", "Feb", "Mar").endsWith("Dec");
        MonthlyGoalProgress jan = goal.monthlyBreakdown().get(0);
        assertThat(jan.target()).isEqualByComparingTo("8333.33");
        assertThat(jan.actual()).isEqualByComparingTo("2000");
        assertThat(jan.complete()).isTrue();
        MonthlyGoalProgress jun = goal.monthlyBreakdown().get(5);
        assertThat(jun.complete()).isTrue();
        MonthlyGoalProgress jul = goal.monthlyBreakdown().get(6);
        assertThat(jul.actual()).isEqualByComparingTo("500");
        assertThat(jul.complete()).isFalse();
    }

    @Test
    void customTarget() {
        GoalProjection goal = projector.projectGoal(annotated(soldWithProfit("a", "10000", "2024-03-01")),
                new BigDecimal("20000"), JULY_2);

        assertThat(goal.progressPercentage()).isEqualByComparingTo("50");
        assertThat(goal.goalAmount()).isEqualByComparingTo("20000");
    }

    @Test
    void rejectsNonPositiveTarget() {
        assertThatThrownBy(() -> projector.projectGoal(List.of(), BigDecimal.ZERO, JULY_2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Goal target must be positive");
    }

    @Test
    void isIdempotent() {
        List<AnnotatedWatch> watches = annotated(soldWithProfit("a", "12345", "2024-04-01"));

        assertThat(projector.projectGoal(watches, JULY_2)).isEqualTo(projector.projectGoal(watches, JULY_2));
    }
}
