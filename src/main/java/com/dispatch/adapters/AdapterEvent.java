package com.dispatch.adapters;

import com.dispatch.shared.model.EventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An event as emitted by an adapter, before the event log assigns it a seq.
 * Process termination travels as a {@link EventType#STATUS_CHANGE} with {@code status = "exited"};
 * the session manager turns it into the session's terminal status event.
 */
public record AdapterEvent(EventType type, JsonNode payload) {

    static final String EXITED = "exited";

    public static AdapterEvent stdoutData(String data) {
        return new AdapterEvent(EventType.STDOUT, object().put("data", data));
    }

    public static AdapterEvent stdoutText(String text) {
        return new AdapterEvent(EventType.STDOUT, object().put("text", text));
    }

    public static AdapterEvent stderrText(String text) {
        return new AdapterEvent(EventType.STDERR, object().put("text", text));
    }

    public static AdapterEvent toolActivity(ObjectNode payload) {
        return new AdapterEvent(EventType.TOOL_ACTIVITY, payload);
    }

    public static AdapterEvent error(String message) {
        return new AdapterEvent(EventType.ERROR, object().put("message", message));
    }

    public static AdapterEvent exited(int exitCode) {
        return new AdapterEvent(EventType.STATUS_CHANGE, object().put("status", EXITED).put("exitCode", exitCode));
    }

    public boolean isExit() {
        return type == EventType.STATUS_CHANGE && EXITED.equals(payload.path("status").asText());
    }

    public int exitCode() {
        return payload.path("exitCode").asInt(0);
    }

    static ObjectNode object() {
        return JsonNodeFactory.instance.objectNode();
    }
}
