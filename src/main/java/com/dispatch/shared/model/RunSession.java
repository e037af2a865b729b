package com.dispatch.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RunSession(
    String id,
    SessionKind kind,
    String workspacePath,
    SessionStatus status,
    Map<String, Object> options,
    Instant createdAt,
    Instant updatedAt
) {
    public RunSession {
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    public RunSession withStatus(SessionStatus newStatus, Instant at) {
        return new RunSession(id, kind, workspacePath, newStatus, options, createdAt, at);
    }
}
