package com.dispatch.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityState {
    IDLE("idle"),
    PROCESSING("processing"),
    STREAMING("streaming");

    private final String wireName;

    ActivityState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }
}
