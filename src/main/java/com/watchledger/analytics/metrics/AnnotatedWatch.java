package com.watchledger.analytics.metrics;

import com.watchledger.analytics.normalizer.NormalizedWatch;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A normalized record with its derived metrics attached; the unit every aggregator consumes.
 */
public record AnnotatedWatch(NormalizedWatch watch, WatchMetrics metrics) {

    public AnnotatedWatch {
        Objects.requireNonNull(watch, "watch must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public BigDecimal netProfit() {
        return metrics.netProfit();
    }
}
