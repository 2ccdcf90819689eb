package com.phillippitts.ambient.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Recovery action offered to the user. */
public enum FallbackAction {
    INSTALL_APP("install_app"),
    OPEN_OAUTH("open_oauth"),
    REQUEST_PERMISSION("request_permission"),
    GENERATE_SCRIPT("generate_script"),
    MANUAL_INSTRUCTION("manual_instruction");

    private final String key;

    FallbackAction(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
