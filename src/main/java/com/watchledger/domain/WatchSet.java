package com.watchledger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What ships with the watch. Unknown labels read as null rather than failing the record.
 */
public enum WatchSet {
    WATCH_ONLY("Watch Only"),
    WATCH_AND_BOX("Watch & Box"),
    WATCH_AND_PAPERS("Watch & Papers"),
    FULL_SET("Full Set");

    private final String label;

    WatchSet(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static WatchSet fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (WatchSet set : values()) {
            if (set.label.equalsIgnoreCase(label.strip()) || set.name().equalsIgnoreCase(label.strip())) {
                return set;
            }
        }
        return null;
    }
}
