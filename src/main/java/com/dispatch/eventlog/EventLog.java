package com.dispatch.eventlog;

import com.dispatch.shared.model.EventType;
import com.dispatch.shared.model.SessionEvent;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Append-only, per-session event record. Seqs start at 1 and have no gaps; an event is durable
 * once {@link #append} returns.
 */
public interface EventLog {

    /**
     * @throws EventLogException when the event could not be stored; no seq is consumed
     */
    SessionEvent append(String sessionId, EventType type, JsonNode payload);

    /** Events with {@code seq > afterSeq}, oldest first. Each iteration re-reads storage lazily. */
    Iterable<SessionEvent> readFrom(String sessionId, long afterSeq);

    /** Events with {@code afterSeq < seq <= throughSeq}, oldest first. */
    Iterable<SessionEvent> readRange(String sessionId, long afterSeq, long throughSeq);

    long latestSeq(String sessionId);

    long count(String sessionId);

    /** Removes every event of the session. Used by retention only. */
    int deleteSession(String sessionId);

    /** Drops in-memory state kept for the session. Safe to call for unknown ids. */
    void forget(String sessionId);
}
