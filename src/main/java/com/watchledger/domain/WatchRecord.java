package com.watchledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.watchledger.common.LenientAmountDeserializer;
import com.watchledger.common.LenientDateDeserializer;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * One inventory item across its whole lifecycle, as delivered by the data-access layer.
 * Every amount and date is optional. Dates are ISO-8601 strings (YYYY-MM-DD) and are only parsed by
 * RecordNormalizer. A record is sold iff both dateSold and priceSold are present.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WatchRecord {

    @EqualsAndHashCode.Include
    private String id;
    private String brand;
    private String model;
    private String referenceNumber;
    private String serialNumber;
    private WatchSet watchSet;

    @JsonDeserialize(using = LenientDateDeserializer.class)
    private String inDate;
    private String platformPurchased;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal purchasePrice;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal accessoriesCost;

    @JsonDeserialize(using = LenientDateDeserializer.class)
    private String dateSold;
    private String platformSold;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal priceSold;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal fees;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal shipping;
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private BigDecimal taxes;
    private String notes;

    private String sellerContactId;
    private String buyerContactId;
}
