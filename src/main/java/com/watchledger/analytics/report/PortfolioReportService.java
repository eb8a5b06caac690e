package com.watchledger.analytics.report;

import com.watchledger.analytics.config.AnalyticsProperties;
import com.watchledger.analytics.contact.AssociationConflictDetector;
import com.watchledger.analytics.contact.ContactRelationshipMetrics;
import com.watchledger.analytics.contact.ContactSummary;
import com.watchledger.analytics.contact.RoleConflict;
import com.watchledger.analytics.goal.GoalProjection;
import com.watchledger.analytics.goal.GoalProjector;
import com.watchledger.analytics.leaderboard.Leaderboard;
import com.watchledger.analytics.leaderboard.LeaderboardParticipant;
import com.watchledger.analytics.leaderboard.LeaderboardRanker;
import com.watchledger.analytics.metrics.AnnotatedWatch;
import com.watchledger.analytics.metrics.MetricsCalculator;
import com.watchledger.analytics.metrics.PortfolioSummary;
import com.watchledger.analytics.metrics.PortfolioSummaryCalculator;
import com.watchledger.analytics.monthly.MonthlyAggregator;
import com.watchledger.analytics.monthly.MonthlyBucket;
import com.watchledger.analytics.normalizer.RecordNormalizer;
import com.watchledger.domain.Contact;
import com.watchledger.domain.Participant;
import com.watchledger.domain.PortfolioSnapshot;
import com.watchledger.domain.WatchRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recomputes the full report for a snapshot: normalizes each record once, annotates it, then runs every
 * aggregator over the annotated collection. Pure with respect to its inputs; the same snapshot and reference
 * date always give an equal report. Cached per (snapshotId, version, referenceDate).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioReportService {

    public static final String REPORT_CACHE = "portfolioReportCache";
    public static final String OWNER_DISPLAY_NAME = "You";

    private final RecordNormalizer recordNormalizer;
    private final MetricsCalculator metricsCalculator;
    private final PortfolioSummaryCalculator portfolioSummaryCalculator;
    private final MonthlyAggregator monthlyAggregator;
    private final GoalProjector goalProjector;
    private final LeaderboardRanker leaderboardRanker;
    private final ContactRelationshipMetrics contactRelationshipMetrics;
    private final AssociationConflictDetector associationConflictDetector;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public static String cacheKey(PortfolioSnapshot snapshot, LocalDate referenceDate) {
        return cacheKeyPrefix(snapshot.snapshotId()) + snapshot.version() + "|" + referenceDate;
    }

    public static String cacheKeyPrefix(String snapshotId) {
        return snapshotId + "|";
    }

    /**
     * Recompute as of today in the configured zone. Shares cache entries with the dated overload; the self call
     * below bypasses the proxy, so this method carries its own key.
     */
    @Cacheable(cacheNames = REPORT_CACHE,
            key = "T(com.watchledger.analytics.report.PortfolioReportService).cacheKey(#snapshot, #root.target.today())")
    public PortfolioReport recompute(PortfolioSnapshot snapshot) {
        return recompute(snapshot, today());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    @Cacheable(cacheNames = REPORT_CACHE,
            key = "T(com.watchledger.analytics.report.PortfolioReportService).cacheKey(#snapshot, #referenceDate)")
    public PortfolioReport recompute(PortfolioSnapshot snapshot, LocalDate referenceDate) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(referenceDate, "referenceDate must not be null");

        List<AnnotatedWatch> watches = annotate(snapshot.watches(), referenceDate);
        PortfolioSummary summary = portfolioSummaryCalculator.summarize(watches);
        List<MonthlyBucket> monthly = monthlyAggregator.aggregateByMonth(watches);
        GoalProjection goal = goalProjector.projectGoal(watches, properties.getGoalTarget(), referenceDate);
        Leaderboard leaderboard = leaderboardRanker.rank(
                participants(snapshot, watches, referenceDate),
                snapshot.ownerParticipantId(),
                Year.of(referenceDate.getYear()),
                properties.getLeaderboardTopN());

        List<ContactSummary> contacts = new ArrayList<>(snapshot.contacts().size());
        for (Contact contact : snapshot.contacts()) {
            if (contact == null) {
                continue;
            }
            contacts.add(contactRelationshipMetrics.summarize(
                    contact, watches, snapshot.associations(), referenceDate, properties.getRecentActivityDays()));
        }

        List<RoleConflict> conflicts = associationConflictDetector.findConflicts(snapshot.associations());
        for (RoleConflict conflict : conflicts) {
            log.warn("Watch {} has {} {} contacts in snapshot {}: {}", conflict.watchId(),
                    conflict.contactIds().size(), conflict.role(), snapshot.snapshotId(), conflict.contactIds());
        }

        log.info("Report for snapshot {} v{} as of {}: {} watches, {} sold, {} months, {} contacts",
                snapshot.snapshotId(), snapshot.version(), referenceDate, watches.size(), summary.totalSold(),
                monthly.size(), contacts.size());
        return new PortfolioReport(snapshot.snapshotId(), snapshot.version(), referenceDate, watches, summary,
                monthly, goal, leaderboard, contacts, conflicts);
    }

    private List<AnnotatedWatch> annotate(List<WatchRecord> records, LocalDate referenceDate) {
        return metricsCalculator.annotateAll(recordNormalizer.normalizeAll(records), referenceDate);
    }

    /**
     * The owner competes with their own annotated inventory; peers sharing the owner's id are ignored.
     */
    private List<LeaderboardParticipant> participants(PortfolioSnapshot snapshot, List<AnnotatedWatch> ownWatches,
                                                      LocalDate referenceDate) {
        List<LeaderboardParticipant> out = new ArrayList<>(snapshot.peers().size() + 1);
        out.add(new LeaderboardParticipant(snapshot.ownerParticipantId(), OWNER_DISPLAY_NAME, ownWatches));
        for (Participant peer : snapshot.peers()) {
            if (peer == null || Objects.equals(peer.participantId(), snapshot.ownerParticipantId())) {
                continue;
            }
            out.add(new LeaderboardParticipant(peer.participantId(), peer.displayName(),
                    annotate(peer.watches(), referenceDate)));
        }
        return out;
    }
}
