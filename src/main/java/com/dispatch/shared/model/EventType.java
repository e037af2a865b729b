package com.dispatch.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    STDIN("stdin"),
    STDOUT("stdout"),
    STDERR("stderr"),
    STATUS_CHANGE("status-change"),
    TOOL_ACTIVITY("tool-activity"),
    RESIZE("resize"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static EventType fromWire(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
