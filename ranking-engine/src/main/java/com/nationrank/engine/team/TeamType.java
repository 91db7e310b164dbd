package com.nationrank.engine.team;

import java.util.Locale;

public enum TeamType {
    PARTY,
    COMMUNITY;

    /**
     * Case-insensitive lookup, e.g. {@code "party"} or {@code "COMMUNITY"}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static TeamType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Team type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown team type: " + value + " (expected party or community)");
        }
    }
}
