package com.watchledger.analytics.report.event;

import com.watchledger.analytics.report.PortfolioReport;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a snapshot change has been recomputed. The presentation side refreshes from {@code report}.
 */
@Getter
public class PortfolioReportReadyEvent extends ApplicationEvent {

    private final PortfolioReport report;

    public PortfolioReportReadyEvent(Object source, PortfolioReport report) {
        super(source);
        this.report = report;
    }

    public String getSnapshotId() {
        return report.snapshotId();
    }

    public long getVersion() {
        return report.version();
    }
}
