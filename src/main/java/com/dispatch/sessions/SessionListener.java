package com.dispatch.sessions;

import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.SessionEvent;

/**
 * Receives a session's live events. Called while the session's lock is held, so implementations
 * must hand off rather than block; the socket transport queues frames for a sender thread.
 */
public interface SessionListener {

    void onEvent(SessionEvent event);

    default void onActivity(String sessionId, ActivityState state) {}
}
