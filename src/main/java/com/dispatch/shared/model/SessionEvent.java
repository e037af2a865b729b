package com.dispatch.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One entry of a session's event log. {@code seq} starts at 1 and has no gaps within a session.
 */
public record SessionEvent(
    String sessionId,
    long seq,
    EventType type,
    JsonNode payload,
    Instant timestamp
) {}
