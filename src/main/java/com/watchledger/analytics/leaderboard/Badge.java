package com.watchledger.analytics.leaderboard;

/**
 * Podium badge for the top three ranks.
 */
public enum Badge {
    TROPHY,
    MEDAL,
    AWARD;

    /**
     * Badge for a 1-based rank; null (no badge) for every rank outside the podium.
     */
    public static Badge forRank(int rank) {
        return switch (rank) {
            case 1 -> TROPHY;
            case 2 -> MEDAL;
            case 3 -> AWARD;
            default -> null;
        };
    }
}
