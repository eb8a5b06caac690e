package com.watchledger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capacity in which a contact relates to a watch. BUYER: the contact bought it from the trader (a sale).
 * SELLER: the contact sold it to the trader (a purchase).
 */
public enum AssociationRole {
    BUYER("Buyer"),
    SELLER("Seller");

    private final String label;

    AssociationRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static AssociationRole fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String trimmed = label.strip();
        for (AssociationRole role : values()) {
            if (role.label.equalsIgnoreCase(trimmed) || role.name().equalsIgnoreCase(trimmed)) {
                return role;
            }
        }
        return null;
    }
}
