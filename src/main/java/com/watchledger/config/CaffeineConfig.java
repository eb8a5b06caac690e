package com.watchledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.watchledger.analytics.config.AnalyticsProperties;
import com.watchledger.analytics.report.PortfolioReportService;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Reports are immutable, so cached values are shared safely between callers.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    @Bean
    public CacheManager caffeineCacheManager(AnalyticsProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PortfolioReportService.REPORT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(properties.getReportCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(properties.getReportCacheMaxSize())
                .build());
        return manager;
    }
}
