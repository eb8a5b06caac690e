package com.watchledger.analytics.monthly;

import com.watchledger.analytics.metrics.AnnotatedWatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups sold-item profit by calendar month. Built fresh on every call; months without sales are simply
 * missing from the output, callers must not assume contiguous coverage.
 */
@Component
public class MonthlyAggregator {

    /**
     * Buckets ascending by period. Only records with dateSold, priceSold and purchasePrice present contribute.
     * Buckets are keyed by YearMonth in a sorted map, so the output does not depend on input order.
     */
    public List<MonthlyBucket> aggregateByMonth(List<AnnotatedWatch> watches) {
        if (watches == null || watches.isEmpty()) {
            return List.of();
        }
        Map<YearMonth, Accumulator> groups = new TreeMap<>();
        for (AnnotatedWatch w : watches) {
            if (!w.watch().isSoldWithCostBasis()) {
                continue;
            }
            groups.computeIfAbsent(YearMonth.from(w.watch().dateSold()), k -> new Accumulator()).add(w.netProfit());
        }
        List<MonthlyBucket> out = new ArrayList<>(groups.size());
        groups.forEach((month, acc) -> out.add(new MonthlyBucket(month, acc.profit, acc.count)));
        return List.copyOf(out);
    }

    /**
     * Narrows buckets to a year and/or a month (1-12); null means "all".
     */
    public List<MonthlyBucket> filter(List<MonthlyBucket> buckets, Integer year, Integer month) {
        if (buckets == null || buckets.isEmpty()) {
            return List.of();
        }
        return buckets.stream()
                .filter(b -> year == null || b.year() == year)
                .filter(b -> month == null || b.month() == month)
                .toList();
    }

    /**
     * Distinct years that have at least one bucket, ascending.
     */
    public List<Integer> years(List<MonthlyBucket> buckets) {
        if (buckets == null || buckets.isEmpty()) {
            return List.of();
        }
        return buckets.stream()
                .map(MonthlyBucket::year)
                .distinct()
                .sorted()
                .toList();
    }

    private static final class Accumulator {
        private BigDecimal profit = BigDecimal.ZERO;
        private int count;

        void add(BigDecimal netProfit) {
            profit = profit.add(netProfit);
            count++;
        }
    }
}
