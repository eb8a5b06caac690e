package com.watchledger.config;

import com.watchledger.analytics.config.AnalyticsProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Binds analytics properties and provides the clock reference dates are read from.
 */
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    @Bean
    public Clock analyticsClock(AnalyticsProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
