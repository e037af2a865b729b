package com.dispatch.gateway.ws;

import com.dispatch.sessions.SessionListener;
import com.dispatch.sessions.Subscription;
import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.SessionEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One WebSocket client and the sessions it is attached to, at most one subscription each.
 * Frames are queued and written by {@code sender} one at a time, so session locks are never held
 * across socket I/O.
 */
class ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final WebSocketSession socket;
    private final ProtocolMessages messages;
    private final Executor sender;
    private final Map<String, SessionStream> streams = new ConcurrentHashMap<>();
    private final Queue<JsonNode> outbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean flushing = new AtomicBoolean();

    ClientConnection(WebSocketSession socket, ProtocolMessages messages, Executor sender) {
        this.socket = socket;
        this.messages = messages;
        this.sender = sender;
    }

    String id() { return socket.getId(); }

    void send(JsonNode frame) {
        outbox.add(frame);
        scheduleFlush();
    }

    private void scheduleFlush() {
        if (!flushing.compareAndSet(false, true)) return;
        try {
            sender.execute(this::flush);
        } catch (RejectedExecutionException e) {
            flushing.set(false);
            log.debug("[ws:{}] sender stopped, dropping {} frames", socket.getId(), outbox.size());
            outbox.clear();
        }
    }

    private void flush() {
        try {
            JsonNode frame;
            while ((frame = outbox.poll()) != null) {
                write(frame);
            }
        } finally {
            flushing.set(false);
        }
        // a frame queued after the last poll
        if (!outbox.isEmpty()) scheduleFlush();
    }

    private void write(JsonNode frame) {
        if (!socket.isOpen()) return;
        try {
            socket.sendMessage(new TextMessage(messages.toText(frame)));
        } catch (SessionLimitExceededException e) {
            // the decorator closes the socket; afterConnectionClosed detaches it
            log.warn("[ws:{}] client too slow, dropping connection: {}", socket.getId(), e.getMessage());
        } catch (IOException | IllegalStateException e) {
            log.debug("[ws:{}] send failed: {}", socket.getId(), e.getMessage());
        }
    }

    SessionStream openStream(String sessionId) {
        var stream = new SessionStream(sessionId);
        var previous = streams.put(sessionId, stream);
        if (previous != null) previous.close();
        return stream;
    }

    boolean detach(String sessionId) {
        var stream = streams.remove(sessionId);
        if (stream == null) return false;
        stream.close();
        return true;
    }

    void detachAll() {
        streams.values().forEach(SessionStream::close);
        streams.clear();
    }

    /**
     * Live events that arrive while the backlog is still being replayed are held back and sent
     * after it, so the client sees one ordered stream.
     */
    class SessionStream implements SessionListener {
        private final String sessionId;
        private final List<SessionEvent> pending = new ArrayList<>();
        private ActivityState pendingActivity;
        private boolean replaying = true;
        private boolean abandoned;
        private volatile Subscription subscription;

        SessionStream(String sessionId) {
            this.sessionId = sessionId;
        }

        void bind(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public synchronized void onEvent(SessionEvent event) {
            if (abandoned) return;
            if (replaying) {
                pending.add(event);
            } else {
                send(messages.event(event));
            }
        }

        @Override
        public synchronized void onActivity(String id, ActivityState state) {
            if (abandoned) return;
            if (replaying) {
                pendingActivity = state;
            } else {
                send(messages.status(id, state));
            }
        }

        /**
         * Sends the backlog, then whatever arrived meanwhile. If the backlog cannot be read the
         * stream is abandoned and its subscription closed before the failure is rethrown.
         */
        void replay(Iterable<SessionEvent> backlog, ActivityState activity) {
            try {
                for (var event : backlog) {
                    send(messages.event(event));
                }
            } catch (RuntimeException e) {
                synchronized (this) {
                    abandoned = true;
                    replaying = false;
                    pending.clear();
                    pendingActivity = null;
                }
                close();
                throw e;
            }
            synchronized (this) {
                pending.forEach(event -> send(messages.event(event)));
                pending.clear();
                send(messages.status(sessionId, pendingActivity != null ? pendingActivity : activity));
                pendingActivity = null;
                replaying = false;
            }
        }

        void close() {
            var sub = subscription;
            if (sub != null) sub.close();
        }
    }
}
