package com.watchledger.analytics.monthly;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Profit and sale count for one calendar month of the sale date. Serialized with its period as YYYY-MM.
 */
public record MonthlyBucket(@JsonIgnore YearMonth yearMonth, BigDecimal profit, int count) {

    @JsonProperty("period")
    public String period() {
        return yearMonth.toString();
    }

    public int year() {
        return yearMonth.getYear();
    }

    public int month() {
        return yearMonth.getMonthValue();
    }
}
