package com.dispatch.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionKind {
    SHELL("shell"),
    AGENT("agent");

    private final String wireName;

    SessionKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static SessionKind fromWire(String value) {
        for (var kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) return kind;
        }
        throw new IllegalArgumentException("Unknown session kind: " + value);
    }
}
