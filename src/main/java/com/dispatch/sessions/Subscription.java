package com.dispatch.sessions;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A listener registration on one session. Closing it only unsubscribes; the session keeps running.
 */
public final class Subscription implements AutoCloseable {

    private final String sessionId;
    private final SessionListener listener;
    private final long afterSeq;
    private final Consumer<Subscription> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    Subscription(String sessionId, SessionListener listener, long afterSeq, Consumer<Subscription> onClose) {
        this.sessionId = sessionId;
        this.listener = listener;
        this.afterSeq = afterSeq;
        this.onClose = onClose;
    }

    static Subscription inactive(String sessionId, SessionListener listener) {
        var sub = new Subscription(sessionId, listener, Long.MAX_VALUE, s -> {});
        sub.closed.set(true);
        return sub;
    }

    public String sessionId() { return sessionId; }

    SessionListener listener() { return listener; }

    /** Live delivery starts strictly after this seq. */
    long afterSeq() { return afterSeq; }

    public boolean isActive() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) onClose.accept(this);
    }
}
