package com.watchledger.analytics.metrics;

import com.watchledger.analytics.normalizer.NormalizedWatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Per-record profit and hold-time figures.
 * netProfit = priceSold - (purchasePrice + accessoriesCost) - fees - shipping - taxes, absent terms count as zero.
 */
@Component
public class MetricsCalculator {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Always returns a number. An unsold record yields its costs as a negative figure, so callers summing
     * "sold" profit must filter on sold status themselves.
     */
    public BigDecimal computeNetProfit(NormalizedWatch watch) {
        return watch.priceSold()
                .subtract(computeTotalIn(watch))
                .subtract(watch.fees())
                .subtract(watch.shipping())
                .subtract(watch.taxes());
    }

    public BigDecimal computeTotalIn(NormalizedWatch watch) {
        return watch.purchasePrice().add(watch.accessoriesCost());
    }

    /**
     * Whole days from inDate to soldDate. Null when either date is missing or soldDate is not strictly after
     * inDate: a zero or negative hold is bad data, not a same-day flip.
     */
    public Integer computeHoldTimeDays(LocalDate inDate, LocalDate soldDate) {
        if (inDate == null || soldDate == null || !soldDate.isAfter(inDate)) {
            return null;
        }
        return Math.toIntExact(ChronoUnit.DAYS.between(inDate, soldDate));
    }

    /**
     * netProfit as a percentage of totalIn, for sold records with a positive totalIn only.
     */
    public BigDecimal computeProfitPercentage(NormalizedWatch watch, BigDecimal netProfit) {
        if (!watch.isSold()) {
            return null;
        }
        BigDecimal totalIn = computeTotalIn(watch);
        if (totalIn.signum() <= 0) {
            return null;
        }
        return netProfit.multiply(HUNDRED).divide(totalIn, SCALE, ROUNDING);
    }

    /**
     * Days an unsold item has been held as of referenceDate; null for sold items or without an inDate.
     */
    public Integer computeDaysInInventory(NormalizedWatch watch, LocalDate referenceDate) {
        if (watch.dateSold() != null) {
            return null;
        }
        return computeHoldTimeDays(watch.inDate(), referenceDate);
    }

    public AnnotatedWatch annotate(NormalizedWatch watch, LocalDate referenceDate) {
        BigDecimal netProfit = computeNetProfit(watch);
        WatchMetrics metrics = new WatchMetrics(
                netProfit,
                computeHoldTimeDays(watch.inDate(), watch.dateSold()),
                computeTotalIn(watch),
                computeProfitPercentage(watch, netProfit),
                computeDaysInInventory(watch, referenceDate));
        return new AnnotatedWatch(watch, metrics);
    }

    public List<AnnotatedWatch> annotateAll(List<NormalizedWatch> watches, LocalDate referenceDate) {
        if (watches == null || watches.isEmpty()) {
            return List.of();
        }
        return watches.stream()
                .map(w -> annotate(w, referenceDate))
                .toList();
    }
}
