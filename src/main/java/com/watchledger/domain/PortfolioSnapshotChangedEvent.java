package com.watchledger.domain;

/**
 * Application event: the record collections behind a snapshot changed (e.g. after a fetch completes).
 * Published by the data-access side; consumed by analytics to recompute the report.
 */
public record PortfolioSnapshotChangedEvent(PortfolioSnapshot snapshot) {
}
