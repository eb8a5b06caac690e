package com.watchledger.analytics.contact;

import java.math.BigDecimal;

/**
 * One side of the trading relationship: how many deals, their total and average value, and how many fall
 * inside the recent-activity window.
 */
public record TradeSideMetrics(int count, BigDecimal total, BigDecimal average, int recent) {

    public static TradeSideMetrics empty() {
        return new TradeSideMetrics(0, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
