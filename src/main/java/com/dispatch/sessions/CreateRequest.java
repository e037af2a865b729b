package com.dispatch.sessions;

import com.dispatch.shared.model.SessionKind;

import java.util.Map;

/**
 * @param sessionId optional client-chosen id; a random id is allocated when absent
 */
public record CreateRequest(String sessionId, SessionKind kind, String workspacePath, Map<String, Object> options) {

    public CreateRequest {
        options = options != null ? options : Map.of();
    }
}
