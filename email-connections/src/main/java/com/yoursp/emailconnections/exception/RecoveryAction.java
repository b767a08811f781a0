package com.yoursp.emailconnections.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a human should do after seeing an error.
 */
public enum RecoveryAction {

    REFRESH("refresh"),
    RETRY("retry"),
    RE_AUTHORIZE("re_authorize"),
    NONE("none");

    private final String value;

    RecoveryAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
