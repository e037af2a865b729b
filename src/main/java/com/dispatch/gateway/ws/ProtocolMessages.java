package com.dispatch.gateway.ws;

import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the JSON frames the server sends. Every frame carries a {@code type}; events are nested
 * under {@code event} so their own {@code type} stays intact.
 */
public class ProtocolMessages {

    private final ObjectMapper mapper;

    public ProtocolMessages(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode event(SessionEvent event) {
        var frame = mapper.createObjectNode().put("type", "event");
        frame.set("event", eventBody(event));
        return frame;
    }

    public ObjectNode eventBody(SessionEvent event) {
        var body = mapper.createObjectNode()
                .put("sessionId", event.sessionId())
                .put("seq", event.seq())
                .put("type", event.type().wireName());
        body.set("payload", event.payload());
        body.put("timestamp", event.timestamp().toEpochMilli());
        return body;
    }

    public ObjectNode status(String sessionId, ActivityState activity) {
        return mapper.createObjectNode()
                .put("type", "status")
                .put("sessionId", sessionId)
                .put("activityState", activity.wireName());
    }

    public ObjectNode ack(String requestId) {
        var frame = mapper.createObjectNode().put("type", "ack");
        if (requestId != null) frame.put("requestId", requestId);
        return frame;
    }

    public ObjectNode error(String requestId, String code, String message) {
        var frame = mapper.createObjectNode().put("type", "error");
        if (requestId != null) frame.put("requestId", requestId);
        return frame.put("code", code).put("message", message);
    }

    public ObjectNode session(RunSession session) {
        var node = mapper.createObjectNode()
                .put("id", session.id())
                .put("kind", session.kind().wireName())
                .put("workspacePath", session.workspacePath())
                .put("status", session.status().wireName());
        node.set("options", mapper.valueToTree(session.options()));
        node.put("createdAt", session.createdAt().toEpochMilli());
        node.put("updatedAt", session.updatedAt().toEpochMilli());
        return node;
    }

    public String toText(JsonNode frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode frame", e);
        }
    }
}
