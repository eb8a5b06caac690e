package com.watchledger.analytics.normalizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A record after the single normalization step. Amounts are never null (absent reads as zero);
 * dates are null when absent or unparseable. {@code hasPurchasePrice} and {@code hasPriceSold} keep
 * "present" apart from "zero" for the sold filters.
 */
public record NormalizedWatch(
        String id,
        String brand,
        String model,
        String referenceNumber,
        LocalDate inDate,
        BigDecimal purchasePrice,
        boolean hasPurchasePrice,
        BigDecimal accessoriesCost,
        LocalDate dateSold,
        BigDecimal priceSold,
        boolean hasPriceSold,
        BigDecimal fees,
        BigDecimal shipping,
        BigDecimal taxes,
        String sellerContactId,
        String buyerContactId
) {

    public NormalizedWatch {
        Objects.requireNonNull(purchasePrice, "purchasePrice must not be null");
        Objects.requireNonNull(accessoriesCost, "accessoriesCost must not be null");
        Objects.requireNonNull(priceSold, "priceSold must not be null");
        Objects.requireNonNull(fees, "fees must not be null");
        Objects.requireNonNull(shipping, "shipping must not be null");
        Objects.requireNonNull(taxes, "taxes must not be null");
    }

    /**
     * Sold iff both the sale date and the sale price are present.
     */
    public boolean isSold() {
        return dateSold != null && hasPriceSold;
    }

    /**
     * Sold and with a known purchase price: the set monthly, goal and summary figures are built from.
     */
    public boolean isSoldWithCostBasis() {
        return isSold() && hasPurchasePrice;
    }
}
