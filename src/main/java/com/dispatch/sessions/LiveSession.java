package com.dispatch.sessions;

import com.dispatch.adapters.AdapterEvent;
import com.dispatch.adapters.RunningProcess;
import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionEvent;
import com.dispatch.shared.model.SessionStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory state of one live session. Every field except the subscriber list is read and
 * written with {@link #lock} held.
 */
final class LiveSession {

    static final int RECENT_EVENTS = 32;

    final ReentrantLock lock = new ReentrantLock();
    // orders writes to the process; taken before lock, never while holding it
    final ReentrantLock inputLock = new ReentrantLock();
    final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    final List<AdapterEvent> startBuffer = new ArrayList<>();
    private final Deque<SessionEvent> recent = new ArrayDeque<>(RECENT_EVENTS);

    private RunSession record;
    RunningProcess process;
    long lastSeq;
    boolean terminal;
    boolean closing;
    boolean abandoned;
    // terminal status-change could not be appended
    boolean terminalUnrecorded;
    boolean activityCheckPending;
    ActivityState activity = ActivityState.IDLE;

    LiveSession(RunSession record, long lastSeq) {
        this.record = record;
        this.lastSeq = lastSeq;
    }

    String id() { return record.id(); }

    RunSession record() { return record; }

    SessionStatus status() { return record.status(); }

    void transition(SessionStatus status, Instant at) {
        record = record.withStatus(status, at);
    }

    void remember(SessionEvent event) {
        lastSeq = event.seq();
        if (recent.size() == RECENT_EVENTS) recent.removeFirst();
        recent.addLast(event);
    }

    List<SessionEvent> recentEvents() {
        return List.copyOf(recent);
    }
}
