package com.dispatch.sessions;

import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.EventType;
import com.dispatch.shared.model.SessionEvent;
import com.dispatch.shared.model.SessionKind;
import com.dispatch.shared.model.SessionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Derives a session's activity from the tail of its event log. The newest event that says
 * anything about activity decides; resize and stderr events are skipped.
 */
public final class ActivityStates {

    private ActivityStates() {}

    /**
     * @param recent the most recent events, oldest first
     */
    public static ActivityState derive(SessionKind kind, SessionStatus status, List<SessionEvent> recent,
                                       Instant now, Duration streamingWindow) {
        if (status != SessionStatus.RUNNING) return ActivityState.IDLE;

        for (int i = recent.size() - 1; i >= 0; i--) {
            var event = recent.get(i);
            switch (event.type()) {
                case RESIZE, STDERR:
                    continue;
                case STATUS_CHANGE, ERROR:
                    return ActivityState.IDLE;
                default:
                    break;
            }
            return kind == SessionKind.SHELL
                    ? shellState(event, now, streamingWindow)
                    : agentState(event);
        }
        return ActivityState.IDLE;
    }

    private static ActivityState shellState(SessionEvent event, Instant now, Duration streamingWindow) {
        if (event.type() != EventType.STDOUT) return ActivityState.IDLE;
        var age = Duration.between(event.timestamp(), now);
        return age.compareTo(streamingWindow) <= 0 ? ActivityState.STREAMING : ActivityState.IDLE;
    }

    private static ActivityState agentState(SessionEvent event) {
        switch (event.type()) {
            case STDOUT:
                return ActivityState.STREAMING;
            case STDIN:
                return ActivityState.PROCESSING;
            case TOOL_ACTIVITY:
                return "turn-end".equals(event.payload().path("phase").asText())
                        ? ActivityState.IDLE
                        : ActivityState.PROCESSING;
            default:
                return ActivityState.IDLE;
        }
    }
}
