package com.labpulse.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse status of a monitored item as shown to viewers.
 */
public enum ItemStatus {
    ONLINE,
    WARNING,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
