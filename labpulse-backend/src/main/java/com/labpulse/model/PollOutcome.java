package com.labpulse.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-integration classification persisted after each poll.
 */
public enum PollOutcome {
    SUCCESS,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PollOutcome fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return "success".equalsIgnoreCase(value.trim()) ? SUCCESS : FAILED;
    }
}
