package com.watchledger.analytics.metrics;

import java.math.BigDecimal;

/**
 * Derived per-record figures. Never persisted; recomputed from source fields on every pass.
 * holdTimeDays, profitPercentage and daysInInventory are null when not computable.
 */
public record WatchMetrics(
        BigDecimal netProfit,
        Integer holdTimeDays,
        BigDecimal totalIn,
        BigDecimal profitPercentage,
        Integer daysInInventory
) {
}
