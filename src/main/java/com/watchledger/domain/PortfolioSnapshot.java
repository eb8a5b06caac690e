package com.watchledger.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable view of everything one report is computed from. The owner's own inventory is {@code watches};
 * {@code peers} are the other leaderboard participants. {@code version} changes whenever any collection changes.
 */
public record PortfolioSnapshot(
        String snapshotId,
        long version,
        String ownerParticipantId,
        List<WatchRecord> watches,
        List<Contact> contacts,
        List<WatchAssociation> associations,
        List<Participant> peers
) {

    public PortfolioSnapshot {
        Objects.requireNonNull(snapshotId, "snapshotId must not be null");
        watches = watches == null ? List.of() : List.copyOf(watches);
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        associations = associations == null ? List.of() : List.copyOf(associations);
        peers = peers == null ? List.of() : List.copyOf(peers);
    }
}
