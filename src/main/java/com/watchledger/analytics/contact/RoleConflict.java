package com.watchledger.analytics.contact;

import com.watchledger.domain.AssociationRole;

import java.util.List;

/**
 * A watch whose role is held by more than one contact; contactIds are in first-seen order.
 */
public record RoleConflict(String watchId, AssociationRole role, List<String> contactIds) {

    public RoleConflict {
        contactIds = contactIds == null ? List.of() : List.copyOf(contactIds);
    }
}
