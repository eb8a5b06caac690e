package com.watchledger.domain;

/**
 * Links a contact to a watch under a role. For a given watch at most one contact should hold each role;
 * a later assignment overwrites the earlier holder upstream, the analytics only report conflicts.
 */
public record WatchAssociation(String contactId, String watchId, AssociationRole role) {
}
