package com.watchledger.domain;

import java.util.List;

/**
 * A peer trader competing on the leaderboard, with the raw records that count toward their score.
 */
public record Participant(String participantId, String displayName, List<WatchRecord> watches) {

    public Participant {
        watches = watches == null ? List.of() : List.copyOf(watches);
    }
}
