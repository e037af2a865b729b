package com.dispatch.sessions;

import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionKind;
import com.dispatch.shared.model.SessionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SessionStore {
    void insert(RunSession session);
    void updateStatus(String sessionId, SessionStatus status, Instant updatedAt);
    Optional<RunSession> find(String sessionId);
    List<RunSession> list(SessionKind kind);
    List<RunSession> findByStatus(Collection<SessionStatus> statuses);
    List<RunSession> findTerminalBefore(Instant cutoff);
    void delete(String sessionId);
}
