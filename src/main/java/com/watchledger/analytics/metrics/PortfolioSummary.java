package com.watchledger.analytics.metrics;

import java.math.BigDecimal;

/**
 * Headline figures over sold records with a known purchase price.
 */
public record PortfolioSummary(
        BigDecimal totalProfit,
        int totalSold,
        BigDecimal avgProfit,
        int avgHoldTimeDays
) {

    public static PortfolioSummary empty() {
        return new PortfolioSummary(BigDecimal.ZERO, 0, BigDecimal.ZERO, 0);
    }
}
