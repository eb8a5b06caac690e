package com.watchledger.analytics.metrics;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Component
public class PortfolioSummaryCalculator {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /**
     * Totals over records that are sold and carry a purchase price. Average hold time is the rounded mean over
     * records that have a hold time, so records with bad dates do not drag it toward zero.
     */
    public PortfolioSummary summarize(List<AnnotatedWatch> watches) {
        if (watches == null || watches.isEmpty()) {
            return PortfolioSummary.empty();
        }
        BigDecimal totalProfit = BigDecimal.ZERO;
        int totalSold = 0;
        long totalHoldDays = 0;
        int withHoldTime = 0;
        for (AnnotatedWatch w : watches) {
            if (!w.watch().isSoldWithCostBasis()) {
                continue;
            }
            totalProfit = totalProfit.add(w.netProfit());
            totalSold++;
            Integer hold = w.metrics().holdTimeDays();
            if (hold != null) {
                totalHoldDays += hold;
                withHoldTime++;
            }
        }
        if (totalSold == 0) {
            return PortfolioSummary.empty();
        }
        BigDecimal avgProfit = totalProfit.divide(BigDecimal.valueOf(totalSold), SCALE, ROUNDING);
        int avgHold = withHoldTime > 0
                ? BigDecimal.valueOf(totalHoldDays).divide(BigDecimal.valueOf(withHoldTime), 0, ROUNDING).intValue()
                : 0;
        return new PortfolioSummary(totalProfit, totalSold, avgProfit, avgHold);
    }
}
