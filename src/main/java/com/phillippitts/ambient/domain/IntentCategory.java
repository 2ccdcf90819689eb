package com.phillippitts.ambient.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of command categories. Each category has exactly one action handler.
 */
public enum IntentCategory {
    OPEN("open"),
    SEARCH("search"),
    EMAIL("email"),
    VIDEO("youtube"),
    HELP("help"),
    UNKNOWN("unknown");

    private final String key;

    IntentCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static IntentCategory fromKey(String key) {
        if (key == null) {
            return UNKNOWN;
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (IntentCategory c : values()) {
            if (c.key.equals(k)) {
                return c;
            }
        }
        return UNKNOWN;
    }
}
