package com.watchledger.analytics.report;

import com.watchledger.analytics.contact.ContactSummary;
import com.watchledger.analytics.contact.RoleConflict;
import com.watchledger.analytics.goal.GoalProjection;
import com.watchledger.analytics.leaderboard.Leaderboard;
import com.watchledger.analytics.metrics.AnnotatedWatch;
import com.watchledger.analytics.metrics.PortfolioSummary;
import com.watchledger.analytics.monthly.MonthlyBucket;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything the presentation layer shows for one snapshot as of one reference date. Plain data, safe to
 * serialize and to share between threads.
 */
public record PortfolioReport(
        String snapshotId,
        long version,
        LocalDate referenceDate,
        List<AnnotatedWatch> watches,
        PortfolioSummary summary,
        List<MonthlyBucket> monthly,
        GoalProjection goal,
        Leaderboard leaderboard,
        List<ContactSummary> contacts,
        List<RoleConflict> roleConflicts
) {

    public PortfolioReport {
        watches = watches == null ? List.of() : List.copyOf(watches);
        monthly = monthly == null ? List.of() : List.copyOf(monthly);
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        roleConflicts = roleConflicts == null ? List.of() : List.copyOf(roleConflicts);
    }
}
