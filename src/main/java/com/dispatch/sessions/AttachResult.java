package com.dispatch.sessions;

import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionEvent;

/**
 * @param backlog      persisted events after the requested seq, up to the point live delivery starts
 * @param subscription inactive when the session is no longer live
 */
public record AttachResult(
    RunSession session,
    Iterable<SessionEvent> backlog,
    Subscription subscription,
    ActivityState activity
) {}
