package com.phillippitts.ambient.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Why an action could not be completed. */
public enum FallbackReason {
    MISSING_APP("missing_app"),
    MISSING_OAUTH("missing_oauth"),
    MISSING_PERMISSION("missing_permission"),
    MISSING_SCRIPT("missing_script"),
    UNKNOWN_ACTION("unknown_action");

    private final String key;

    FallbackReason(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Parses a wire key. Unrecognised keys yield null, which the resolver answers with a
     * generic failure instead of rejecting the request.
     */
    @JsonCreator
    public static FallbackReason fromKey(String key) {
        if (key == null) {
            return null;
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (FallbackReason r : values()) {
            if (r.key.equals(k)) {
                return r;
            }
        }
        return null;
    }
}
