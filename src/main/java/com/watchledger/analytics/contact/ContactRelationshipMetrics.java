package com.watchledger.analytics.contact;

import com.watchledger.analytics.metrics.AnnotatedWatch;
import com.watchledger.analytics.normalizer.NormalizedWatch;
import com.watchledger.domain.AssociationRole;
import com.watchledger.domain.Contact;
import com.watchledger.domain.WatchAssociation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Splits a contact's associated records into purchases (contact was SELLER) and sales (contact was BUYER)
 * and computes the trader's net position with them.
 */
@Component
public class ContactRelationshipMetrics {

    public static final int DEFAULT_RECENT_WINDOW_DAYS = 90;

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public ContactSummary summarize(Contact contact, List<AnnotatedWatch> allRecords,
                                    List<WatchAssociation> allAssociations, LocalDate referenceDate) {
        return summarize(contact, allRecords, allAssociations, referenceDate, DEFAULT_RECENT_WINDOW_DAYS);
    }

    /**
     * Associations pointing at records that are not in allRecords are skipped.
     * Sales are recent by dateSold, purchases by inDate, both within recentWindowDays before referenceDate.
     */
    public ContactSummary summarize(Contact contact, List<AnnotatedWatch> allRecords,
                                    List<WatchAssociation> allAssociations, LocalDate referenceDate,
                                    int recentWindowDays) {
        Objects.requireNonNull(contact, "contact must not be null");
        Objects.requireNonNull(referenceDate, "referenceDate must not be null");
        Map<String, NormalizedWatch> byId = index(allRecords);

        List<NormalizedWatch> sold = new ArrayList<>();
        List<NormalizedWatch> bought = new ArrayList<>();
        if (allAssociations != null) {
            for (WatchAssociation a : allAssociations) {
                if (a == null || !Objects.equals(contact.getId(), a.contactId()) || a.role() == null) {
                    continue;
                }
                NormalizedWatch w = byId.get(a.watchId());
                if (w == null) {
                    continue;
                }
                if (a.role() == AssociationRole.BUYER) {
                    sold.add(w);
                } else {
                    bought.add(w);
                }
            }
        }

        LocalDate windowStart = referenceDate.minusDays(recentWindowDays);
        TradeSideMetrics sales = side(sold, NormalizedWatch::priceSold, NormalizedWatch::dateSold, windowStart);
        TradeSideMetrics purchase = side(bought, NormalizedWatch::purchasePrice, NormalizedWatch::inDate, windowStart);

        RelationshipMetrics relationship = new RelationshipMetrics(
                sales.total().add(purchase.total()),
                sales.total().subtract(purchase.total()),
                sales.count() + purchase.count(),
                favoriteBrand(sold, bought));

        return new ContactSummary(contact.getId(), contact.displayName(), contact.getContactType(),
                purchase, sales, relationship);
    }

    private static TradeSideMetrics side(List<NormalizedWatch> watches,
                                         Function<NormalizedWatch, BigDecimal> amount,
                                         Function<NormalizedWatch, LocalDate> activityDate,
                                         LocalDate windowStart) {
        if (watches.isEmpty()) {
            return TradeSideMetrics.empty();
        }
        BigDecimal total = BigDecimal.ZERO;
        int recent = 0;
        for (NormalizedWatch w : watches) {
            total = total.add(amount.apply(w));
            LocalDate date = activityDate.apply(w);
            if (date != null && !date.isBefore(windowStart)) {
                recent++;
            }
        }
        BigDecimal average = total.divide(BigDecimal.valueOf(watches.size()), SCALE, ROUNDING);
        return new TradeSideMetrics(watches.size(), total, average, recent);
    }

    /**
     * Most frequent brand across sales then purchases; a later brand only wins with a strictly higher count.
     */
    private static FavoriteBrand favoriteBrand(List<NormalizedWatch> sold, List<NormalizedWatch> bought) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<NormalizedWatch> all = new ArrayList<>(sold.size() + bought.size());
        all.addAll(sold);
        all.addAll(bought);
        for (NormalizedWatch w : all) {
            if (w.brand() == null || w.brand().isBlank()) {
                continue;
            }
            counts.merge(w.brand(), 1, Integer::sum);
        }
        FavoriteBrand best = FavoriteBrand.NONE;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best.count()) {
                best = new FavoriteBrand(e.getKey(), e.getValue());
            }
        }
        return best;
    }

    private static Map<String, NormalizedWatch> index(List<AnnotatedWatch> records) {
        Map<String, NormalizedWatch> byId = new HashMap<>();
        if (records == null) {
            return byId;
        }
        for (AnnotatedWatch r : records) {
            if (r.watch().id() != null) {
                byId.putIfAbsent(r.watch().id(), r.watch());
            }
        }
        return byId;
    }
}
