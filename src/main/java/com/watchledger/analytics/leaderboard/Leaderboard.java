package com.watchledger.analytics.leaderboard;

import java.util.List;

/**
 * Ranked view for one season. userRank is null when the current user has no entry.
 */
public record Leaderboard(
        List<LeaderboardEntry> entries,
        Integer userRank,
        int totalParticipants,
        String season
) {

    public Leaderboard {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
