package com.watchledger.analytics.report;

import com.watchledger.analytics.config.AnalyticsProperties;
import com.watchledger.analytics.contact.AssociationConflictDetector;
import com.watchledger.analytics.contact.ContactRelationshipMetrics;
import com.watchledger.analytics.contact.ContactSummary;
import com.watchledger.analytics.goal.GoalProjector;
import com.watchledger.analytics.leaderboard.LeaderboardEntry;
import com.watchledger.analytics.leaderboard.LeaderboardRanker;
import com.watchledger.analytics.metrics.MetricsCalculator;
import com.watchledger.analytics.metrics.PortfolioSummaryCalculator;
import com.watchledger.analytics.monthly.MonthlyAggregator;
import com.watchledger.analytics.monthly.MonthlyBucket;
import com.watchledger.analytics.normalizer.RecordNormalizer;
import com.watchledger.domain.AssociationRole;
import com.watchledger.domain.Contact;
import com.watchledger.domain.Participant;
import com.watchledger.domain.PortfolioSnapshot;
import com.watchledger.domain.WatchAssociation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.watchledger.analytics.WatchFixtures.inStock;
import static com.watchledger.analytics.WatchFixtures.sold;
import static com.watchledger.analytics.WatchFixtures.soldWithProfit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioReportServiceTest {

    private static final LocalDate TODAY = LocalDate.parse("2024-07-02");

    private AnalyticsProperties properties;
    private PortfolioReportService service;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-07-02T12:00:00Z"), ZoneOffset.UTC);
        service = new PortfolioReportService(
                new RecordNormalizer(),
                new MetricsCalculator(),
                new PortfolioSummaryCalculator(),
                new MonthlyAggregator(),
                new GoalProjector(),
                new LeaderboardRanker(),
                new ContactRelationshipMetrics(),
                new AssociationConflictDetector(),
                properties,
                clock);
    }

    private static Contact contact(String id, String first, String last) {
        Contact c = new Contact();
        c.setId(id);
        c.setFirstName(first);
        c.setLastName(last);
        return c;
    }

    private static PortfolioSnapshot snapshot() {
        return new PortfolioSnapshot("s1", 7, "me",
                List.of(
                        sold("w1", "Rolex", "8000", "10000", "2024-01-01", "2024-01-11"),
                        sold("w2", "Omega", "3000", "3500", "2024-02-01", "2024-02-21"),
                        inStock("w3", "Tudor", "2000", "2024-06-01")),
                List.of(contact("c1", "Ada", "Lovelace"), contact("c2", "Alan", "Turing")),
                List.of(
                        new WatchAssociation("c1", "w1", AssociationRole.BUYER),
                        new WatchAssociation("c2", "w1", AssociationRole.BUYER),
                        new WatchAssociation("c1", "w3", AssociationRole.SELLER)),
                List.of(
                        new Participant("p1", "Peer One", List.of(soldWithProfit("p1-a", "5000", "2024-03-01"))),
                        new Participant("me", "Duplicate of owner", List.of(soldWithProfit("x", "99999", "2024-03-01")))));
    }

    @Test
    @DisplayName("runs every aggregator over the annotated snapshot")
    void recompute_buildsFullReport() {
        PortfolioReport report = service.recompute(snapshot(), TODAY);

        assertThat(report.snapshotId()).isEqualTo("s1");
        assertThat(report.version()).isEqualTo(7);
        assertThat(report.referenceDate()).isEqualTo(TODAY);
        assertThat(report.watches()).hasSize(3);

        assertThat(report.summary().totalProfit()).isEqualByComparingTo("2500");
        assertThat(report.summary().totalSold()).isEqualTo(2);
        assertThat(report.monthly()).extracting(MonthlyBucket::period).containsExactly("2024-01", "2024-02");

        assertThat(report.goal().currentYearProfit()).isEqualByComparingTo("2500");
        assertThat(report.goal().goalAmount()).isEqualByComparingTo("100000");
        assertThat(report.goal().daysLeftInYear()).isEqualTo(183);
    }

    @Test
    @DisplayName("owner ranks as 'You' and peers sharing the owner's id are skipped")
    void recompute_ranksOwnerAgainstPeers() {
        PortfolioReport report = service.recompute(snapshot(), TODAY);

        assertThat(report.leaderboard().totalParticipants()).isEqualTo(2);
        assertThat(report.leaderboard().entries())
                .extracting(LeaderboardEntry::displayName).containsExactly("Peer One", "You");
        assertThat(report.leaderboard().userRank()).isEqualTo(2);
        assertThat(report.leaderboard().season()).isEqualTo("2024 Annual");
    }

    @Test
    void recompute_summarizesEveryContactAndReportsConflicts() {
        PortfolioReport report = service.recompute(snapshot(), TODAY);

        assertThat(report.contacts()).extracting(ContactSummary::contactName).containsExactly("Ada Lovelace", "Alan Turing");
        ContactSummary ada = report.contacts().get(0);
        assertThat(ada.sales().total()).isEqualByComparingTo("10000");
        assertThat(ada.purchase().total()).isEqualByComparingTo("2000");
        assertThat(ada.relationship().netProfit()).isEqualByComparingTo("8000");

        assertThat(report.roleConflicts()).singleElement().satisfies(c -> {
            assertThat(c.watchId()).isEqualTo("w1");
            assertThat(c.contactIds()).containsExactly("c1", "c2");
        });
    }

    @Test
    void recompute_appliesConfiguredGoalAndTopN() {
        properties.setGoalTarget(new BigDecimal("5000"));
        properties.setLeaderboardTopN(1);

        PortfolioReport report = service.recompute(snapshot(), TODAY);

        assertThat(report.goal().progressPercentage()).isEqualByComparingTo("50");
        assertThat(report.leaderboard().entries()).extracting(LeaderboardEntry::displayName)
                .containsExactly("Peer One", "You");
    }

    @Test
    @DisplayName("owner's leaderboard total equals the goal's current-year profit")
    void recompute_leaderboardAgreesWithGoal() {
        PortfolioSnapshot snapshot = new PortfolioSnapshot("s2", 1, "me",
                List.of(
                        sold("w1", "Rolex", "8000", "10000", null, "2024-03-01"),
                        sold("w2", "Rolex", null, "4000", null, "2024-03-02")),
                List.of(), List.of(), List.of());

        PortfolioReport report = service.recompute(snapshot, TODAY);

        assertThat(report.leaderboard().entries().get(0).totalProfit())
                .isEqualByComparingTo(report.goal().currentYearProfit());
    }

    @Test
    void recompute_isPureForEqualInputs() {
        assertThat(service.recompute(snapshot(), TODAY)).isEqualTo(service.recompute(snapshot(), TODAY));
    }

    @Test
    void recompute_withoutDate_usesClock() {
        assertThat(service.recompute(snapshot()).referenceDate()).isEqualTo(TODAY);
    }

    @Test
    void recompute_emptySnapshot() {
        PortfolioReport report = service.recompute(
                new PortfolioSnapshot("empty", 1, "me", null, null, null, null), TODAY);

        assertThat(report.watches()).isEmpty();
        assertThat(report.summary().totalSold()).isZero();
        assertThat(report.monthly()).isEmpty();
        assertThat(report.goal().monthlyBreakdown()).hasSize(12);
        assertThat(report.leaderboard().entries()).singleElement()
                .extracting(LeaderboardEntry::rank).isEqualTo(1);
        assertThat(report.contacts()).isEmpty();
        assertThat(report.roleConflicts()).isEmpty();
    }

    @Test
    void cacheKey_combinesIdVersionAndDate() {
        assertThat(PortfolioReportService.cacheKey(snapshot(), TODAY)).isEqualTo("s1|7|2024-07-02");
        assertThat(PortfolioReportService.cacheKey(snapshot(), TODAY))
                .startsWith(PortfolioReportService.cacheKeyPrefix("s1"));
    }

    @Test
    void recompute_rejectsNullSnapshot() {
        assertThatThrownBy(() -> service.recompute(null, TODAY))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("snapshot must not be null");
    }
}
