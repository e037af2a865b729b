package com.dispatch.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a run session: {@code starting -> running -> stopped | errored},
 * or {@code starting -> errored} when the process never came up.
 */
public enum SessionStatus {
    STARTING("starting"),
    RUNNING("running"),
    STOPPED("stopped"),
    ERRORED("errored");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isTerminal() {
        return this == STOPPED || this == ERRORED;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        for (var status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
