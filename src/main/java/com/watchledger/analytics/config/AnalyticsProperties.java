package com.watchledger.analytics.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Analytics configuration. Documented in application.yml under watchledger.analytics.
 */
@ConfigurationProperties(prefix = "watchledger.analytics")
@Validated
@Getter
@Setter
public class AnalyticsProperties {

    /**
     * Annual net profit target the goal projection tracks.
     */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal goalTarget = new BigDecimal("100000");

    /**
     * Trailing window (days before the reference date) for "recent" contact activity.
     */
    @Min(0)
    private int recentActivityDays = 90;

    /**
     * Leaderboard entries shown; the current user is appended when ranked below.
     */
    @Min(1)
    private int leaderboardTopN = 10;

    /**
     * Zone used to turn the clock into a reference date.
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * Report cache: minutes a computed report stays cached.
     */
    @Min(1)
    private int reportCacheTtlMinutes = 10;

    /**
     * Report cache: maximum cached reports.
     */
    @Min(1)
    private int reportCacheMaxSize = 500;
}
