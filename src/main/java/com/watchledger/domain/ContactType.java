package com.watchledger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactType {
    LEAD("Lead"),
    CUSTOMER("Customer"),
    WATCH_TRADER("Watch Trader"),
    JEWELER("Jeweler");

    private final String label;

    ContactType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Unknown or missing labels fall back to LEAD, the type new contacts start with.
     */
    @JsonCreator
    public static ContactType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return LEAD;
        }
        String trimmed = label.strip();
        for (ContactType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return LEAD;
    }
}
