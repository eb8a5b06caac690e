package com.watchledger.analytics.goal;

import java.math.BigDecimal;

/**
 * One month of the goal breakdown: month is the short English name (Jan..Dec), target is goal / 12.
 */
public record MonthlyGoalProgress(String month, BigDecimal target, BigDecimal actual, boolean complete) {
}
