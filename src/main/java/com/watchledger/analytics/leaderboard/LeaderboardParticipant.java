package com.watchledger.analytics.leaderboard;

import com.watchledger.analytics.metrics.AnnotatedWatch;

import java.util.List;

/**
 * A participant with already-annotated records, ready to be scored.
 */
public record LeaderboardParticipant(String participantId, String displayName, List<AnnotatedWatch> watches) {

    public LeaderboardParticipant {
        watches = watches == null ? List.of() : List.copyOf(watches);
    }
}
