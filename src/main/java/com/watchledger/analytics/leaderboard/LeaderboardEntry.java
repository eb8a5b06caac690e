package com.watchledger.analytics.leaderboard;

import java.math.BigDecimal;

public record LeaderboardEntry(
        String participantId,
        String displayName,
        BigDecimal totalProfit,
        int watchesSold,
        BigDecimal avgProfit,
        int rank,
        Badge badge,
        boolean isCurrentUser
) {
}
