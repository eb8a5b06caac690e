package com.watchledger.analytics.report;

import com.watchledger.analytics.report.event.PortfolioReportReadyEvent;
import com.watchledger.domain.PortfolioSnapshot;
import com.watchledger.domain.PortfolioSnapshotChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Listens for PortfolioSnapshotChangedEvent; drops the snapshot's cached reports, recomputes as of today and
 * publishes PortfolioReportReadyEvent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PortfolioRecalculationListener {

    private final PortfolioReportService portfolioReportService;
    private final CacheManager cacheManager;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    @EventListener
    public void onSnapshotChanged(PortfolioSnapshotChangedEvent event) {
        PortfolioSnapshot snapshot = event.snapshot();
        if (snapshot == null) {
            log.warn("Ignoring snapshot change event without a snapshot");
            return;
        }
        evict(snapshot.snapshotId());
        try {
            PortfolioReport report = portfolioReportService.recompute(snapshot, LocalDate.now(clock));
            applicationEventPublisher.publishEvent(new PortfolioReportReadyEvent(this, report));
            log.debug("Report ready for snapshot {} v{}", snapshot.snapshotId(), snapshot.version());
        } catch (RuntimeException e) {
            log.error("Recompute failed for snapshot {} v{}: {}", snapshot.snapshotId(), snapshot.version(),
                    e.getMessage(), e);
            throw e;
        }
    }

    private void evict(String snapshotId) {
        Cache cache = cacheManager.getCache(PortfolioReportService.REPORT_CACHE);
        if (cache instanceof CaffeineCache caffeineCache) {
            String prefix = PortfolioReportService.cacheKeyPrefix(snapshotId);
            caffeineCache.getNativeCache().asMap().keySet()
                    .removeIf(key -> key instanceof String s && s.startsWith(prefix));
        } else if (cache != null) {
            cache.clear();
        }
    }
}
