package com.watchledger.analytics.leaderboard;

import com.watchledger.analytics.metrics.AnnotatedWatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks participants by the profit of their sold records within a season (calendar year). A sale counts only
 * with a purchase price, the same filter the goal and monthly views use, so the owner's total matches the
 * goal's current-year profit.
 *
 * <p>Entries are sorted descending by total profit with {@link List#sort}, which is stable: participants with
 * equal totals keep their input order and receive consecutive ranks.
 */
@Component
public class LeaderboardRanker {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public Leaderboard rank(List<LeaderboardParticipant> participants, String currentParticipantId, Year season) {
        return rank(participants, currentParticipantId, season, Integer.MAX_VALUE);
    }

    /**
     * @param topN maximum entries returned; the current user's entry is appended when it ranks below the cut.
     *             totalParticipants always counts everyone.
     */
    public Leaderboard rank(List<LeaderboardParticipant> participants, String currentParticipantId, Year season,
                            int topN) {
        Objects.requireNonNull(season, "season must not be null");
        String label = season.getValue() + " Annual";
        if (participants == null || participants.isEmpty()) {
            return new Leaderboard(List.of(), null, 0, label);
        }

        List<Score> scores = new ArrayList<>(participants.size());
        for (LeaderboardParticipant p : participants) {
            scores.add(score(p, season));
        }
        scores.sort(Comparator.comparing(Score::totalProfit).reversed());

        List<LeaderboardEntry> ranked = new ArrayList<>(scores.size());
        LeaderboardEntry userEntry = null;
        for (int i = 0; i < scores.size(); i++) {
            Score s = scores.get(i);
            int rank = i + 1;
            boolean current = currentParticipantId != null && currentParticipantId.equals(s.participantId());
            LeaderboardEntry entry = new LeaderboardEntry(
                    s.participantId(), s.displayName(), s.totalProfit(), s.watchesSold(), s.avgProfit(),
                    rank, Badge.forRank(rank), current);
            ranked.add(entry);
            if (current && userEntry == null) {
                userEntry = entry;
            }
        }

        int limit = Math.max(0, Math.min(topN, ranked.size()));
        List<LeaderboardEntry> entries = new ArrayList<>(ranked.subList(0, limit));
        if (userEntry != null && userEntry.rank() > limit) {
            entries.add(userEntry);
        }
        return new Leaderboard(entries, userEntry != null ? userEntry.rank() : null, ranked.size(), label);
    }

    private static Score score(LeaderboardParticipant p, Year season) {
        BigDecimal total = BigDecimal.ZERO;
        int sold = 0;
        for (AnnotatedWatch w : p.watches()) {
            if (!w.watch().isSoldWithCostBasis() || w.watch().dateSold().getYear() != season.getValue()) {
                continue;
            }
            total = total.add(w.netProfit());
            sold++;
        }
        BigDecimal avg = sold > 0 ? total.divide(BigDecimal.valueOf(sold), SCALE, ROUNDING) : BigDecimal.ZERO;
        return new Score(p.participantId(), p.displayName(), total, sold, avg);
    }

    private record Score(String participantId, String displayName, BigDecimal totalProfit, int watchesSold,
                         BigDecimal avgProfit) {}
}
