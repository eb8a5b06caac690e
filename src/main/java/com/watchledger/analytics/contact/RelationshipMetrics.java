package com.watchledger.analytics.contact;

import java.math.BigDecimal;

/**
 * Net position with a contact, from the trader's side: netProfit = sales total - purchase total.
 */
public record RelationshipMetrics(
        BigDecimal totalVolume,
        BigDecimal netProfit,
        int dealCount,
        FavoriteBrand favoriteBrand
) {
}
