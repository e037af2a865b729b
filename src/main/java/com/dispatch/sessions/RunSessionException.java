package com.dispatch.sessions;

public class RunSessionException extends RuntimeException {

    public enum Reason {
        SPAWN_FAILURE,
        SESSION_NOT_FOUND,
        SESSION_NOT_RUNNING,
        PERSISTENCE_FAILURE,
        UNSUPPORTED_OPERATION,
        INVALID_REQUEST
    }

    private final Reason reason;
    private final String sessionId;

    public RunSessionException(Reason reason, String sessionId, String message) {
        this(reason, sessionId, message, null);
    }

    public RunSessionException(Reason reason, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.sessionId = sessionId;
    }

    public Reason reason() { return reason; }

    public String sessionId() { return sessionId; }

    static RunSessionException notFound(String sessionId) {
        return new RunSessionException(Reason.SESSION_NOT_FOUND, sessionId, "Session not found: " + sessionId);
    }

    static RunSessionException notRunning(String sessionId) {
        return new RunSessionException(Reason.SESSION_NOT_RUNNING, sessionId, "Session is not running: " + sessionId);
    }
}
