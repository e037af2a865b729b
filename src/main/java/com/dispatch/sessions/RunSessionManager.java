package com.dispatch.sessions;

import com.dispatch.adapters.AdapterEvent;
import com.dispatch.adapters.AdapterRegistry;
import com.dispatch.adapters.EventSink;
import com.dispatch.adapters.ProcessAdapter;
import com.dispatch.adapters.RunningProcess;
import com.dispatch.adapters.StartRequest;
import com.dispatch.eventlog.EventLog;
import com.dispatch.eventlog.EventLogException;
import com.dispatch.eventlog.ResilientCall;
import com.dispatch.observability.RuntimeMetrics;
import com.dispatch.shared.config.RuntimeConfig;
import com.dispatch.shared.model.ActivityState;
import com.dispatch.shared.model.EventType;
import com.dispatch.shared.model.RunSession;
import com.dispatch.shared.model.SessionEvent;
import com.dispatch.shared.model.SessionKind;
import com.dispatch.shared.model.SessionStatus;
import com.dispatch.workspace.SessionDirectory;
import com.dispatch.workspace.WorkspaceInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static com.dispatch.sessions.RunSessionException.Reason.INVALID_REQUEST;
import static com.dispatch.sessions.RunSessionException.Reason.PERSISTENCE_FAILURE;
import static com.dispatch.sessions.RunSessionException.Reason.SESSION_NOT_RUNNING;
import static com.dispatch.sessions.RunSessionException.Reason.SPAWN_FAILURE;
import static com.dispatch.sessions.RunSessionException.Reason.UNSUPPORTED_OPERATION;

/**
 * Owns every live run session. Each session has one lock; status transitions, seq assignment with
 * fan-out to subscribers, and subscription registration all happen while it is held, so every
 * subscriber observes the same order as the event log.
 */
public class RunSessionManager {

    private static final Logger log = LoggerFactory.getLogger(RunSessionManager.class);

    private final AdapterRegistry adapters;
    private final EventLog eventLog;
    private final SessionStore store;
    private final SessionDirectory directory;
    private final RuntimeConfig config;
    private final RuntimeMetrics metrics;
    private final ExecutorService executor;
    private final Clock clock;
    private final Map<String, LiveSession> live = new ConcurrentHashMap<>();

    public RunSessionManager(AdapterRegistry adapters, EventLog eventLog, SessionStore store,
                             SessionDirectory directory, RuntimeConfig config, RuntimeMetrics metrics,
                             ExecutorService executor, Clock clock) {
        this.adapters = adapters;
        this.eventLog = eventLog;
        this.store = store;
        this.directory = directory;
        this.config = config;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        metrics.liveSessions(live::size);
    }

    // --- lifecycle ---

    /**
     * Creates and starts a session, returning its id. An id that is already live, or that belongs
     * to a finished session, is returned as is without starting anything.
     */
    public String create(CreateRequest request) {
        if (request.kind() == null) {
            throw new RunSessionException(INVALID_REQUEST, request.sessionId(), "kind is required");
        }
        var adapter = adapters.get(request.kind());
        if (adapter == null) {
            throw new RunSessionException(INVALID_REQUEST, request.sessionId(),
                    "No adapter registered for kind: " + request.kind().wireName());
        }
        Path workspace;
        try {
            workspace = directory.validateWorkspace(request.workspacePath());
        } catch (IllegalArgumentException e) {
            throw new RunSessionException(INVALID_REQUEST, request.sessionId(), e.getMessage(), e);
        }

        var id = request.sessionId() != null && !request.sessionId().isBlank()
                ? request.sessionId()
                : UUID.randomUUID().toString();
        var now = clock.instant();
        var record = new RunSession(id, request.kind(), workspace.toString(), SessionStatus.STARTING,
                request.options(), now, now);
        var session = new LiveSession(record, 0);
        if (live.putIfAbsent(id, session) != null) {
            log.debug("Session {} is already live", id);
            return id;
        }

        try {
            if (store.find(id).isPresent()) {
                live.remove(id, session);
                log.info("Session {} already finished, not restarting it", id);
                return id;
            }
            store.insert(record);
        } catch (RuntimeException e) {
            live.remove(id, session);
            throw new RunSessionException(PERSISTENCE_FAILURE, id, "Failed to register session: " + id, e);
        }
        metrics.sessionsCreated(request.kind().wireName()).increment();
        log.info("Starting {} session {} in {}", request.kind().wireName(), id, workspace);

        RunningProcess process;
        try {
            process = startAdapter(adapter, session, new StartRequest(id, workspace, request.options()));
        } catch (RunSessionException e) {
            failStart(session, e.getMessage());
            throw e;
        }
        activate(session, process);
        return id;
    }

    private RunningProcess startAdapter(ProcessAdapter adapter, LiveSession session, StartRequest request) {
        EventSink sink = event -> onAdapterEvent(session, event);
        Future<RunningProcess> future = executor.submit(() -> {
            var process = adapter.start(request, sink);
            boolean abandoned;
            session.lock.lock();
            try {
                abandoned = session.abandoned;
            } finally {
                session.lock.unlock();
            }
            if (abandoned) {
                log.warn("Session {} came up after its start timeout, stopping it", session.id());
                process.stop(config.stopTimeout());
            }
            return process;
        });

        long timeoutMs = config.startTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(session, future);
            throw new RunSessionException(SPAWN_FAILURE, session.id(), "Start timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            throw new RunSessionException(SPAWN_FAILURE, session.id(),
                    "Failed to start " + adapter.kind().wireName() + " session: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(session, future);
            throw new RunSessionException(SPAWN_FAILURE, session.id(), "Interrupted while starting session", e);
        }
    }

    private void abandon(LiveSession session, Future<RunningProcess> future) {
        session.lock.lock();
        try {
            session.abandoned = true;
        } finally {
            session.lock.unlock();
        }
        if (future.cancel(true)) return;
        // start completed between the timeout and the flag being set
        try {
            future.get().stop(config.stopTimeout());
        } catch (ExecutionException e) {
            log.debug("Abandoned start of session {} failed: {}", session.id(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void failStart(LiveSession session, String message) {
        session.lock.lock();
        try {
            session.terminal = true;
            session.startBuffer.clear();
            var previous = session.status();
            session.transition(SessionStatus.ERRORED, clock.instant());
            try {
                record(session, EventType.STATUS_CHANGE,
                        statusPayload(SessionStatus.ERRORED, previous).put("reason", message));
            } catch (RunSessionException e) {
                session.terminalUnrecorded = true;
                log.error("Failed to record start failure of session {}", session.id(), e);
            }
            updateStoredStatus(session);
        } finally {
            session.lock.unlock();
        }
        live.remove(session.id(), session);
        eventLog.forget(session.id());
        metrics.sessionsFailed(session.record().kind().wireName()).increment();
        log.warn("Session {} failed to start: {}", session.id(), message);
    }

    private void activate(LiveSession session, RunningProcess process) {
        boolean closeRequested;
        session.lock.lock();
        try {
            session.process = process;
            session.transition(SessionStatus.RUNNING, clock.instant());
            try {
                record(session, EventType.STATUS_CHANGE, statusPayload(SessionStatus.RUNNING, SessionStatus.STARTING));
                updateStoredStatus(session);
                var buffered = new ArrayList<>(session.startBuffer);
                session.startBuffer.clear();
                for (var event : buffered) {
                    applyAdapterEvent(session, event);
                }
            } catch (RunSessionException e) {
                forceErrored(session, e);
                throw e;
            }
            closeRequested = session.closing;
        } finally {
            session.lock.unlock();
        }
        log.info("Session {} is running", session.id());
        if (closeRequested) finishClose(session, process, false);
    }

    /**
     * Stops the session's process and records its terminal status. Closing a finished session is
     * a no-op.
     *
     * @throws RunSessionException {@code SESSION_NOT_FOUND} for ids that never existed
     */
    public void close(String sessionId) {
        var session = live.get(sessionId);
        if (session == null) {
            if (findStored(sessionId).isPresent()) return;
            throw RunSessionException.notFound(sessionId);
        }
        RunningProcess process;
        boolean alreadyTerminal;
        session.lock.lock();
        try {
            if (session.closing) return;
            session.closing = true;
            if (session.status() == SessionStatus.STARTING && !session.terminal) {
                log.info("Close requested while session {} is starting", sessionId);
                return;
            }
            process = session.process;
            alreadyTerminal = session.terminal;
        } finally {
            session.lock.unlock();
        }
        finishClose(session, process, alreadyTerminal);
    }

    private void finishClose(LiveSession session, RunningProcess process, boolean alreadyTerminal) {
        if (process != null && !alreadyTerminal) {
            process.stop(config.stopTimeout());
        }
        boolean unrecorded;
        session.lock.lock();
        try {
            terminate(session, null);
            unrecorded = session.terminalUnrecorded;
        } finally {
            session.lock.unlock();
        }
        live.remove(session.id(), session);
        eventLog.forget(session.id());
        if (unrecorded && !alreadyTerminal) {
            throw new RunSessionException(PERSISTENCE_FAILURE, session.id(),
                    "Session " + session.id() + " was stopped but its terminal status could not be recorded");
        }
    }

    /** Closes every live session. */
    public void shutdown() {
        for (var id : List.copyOf(live.keySet())) {
            try {
                close(id);
            } catch (RuntimeException e) {
                log.warn("Failed to close session {} during shutdown", id, e);
            }
        }
    }

    /**
     * Marks sessions left {@code starting} or {@code running} by a previous process as errored, and
     * appends the missing terminal {@code status-change} to errored sessions whose log lacks one.
     */
    public int recoverOrphans() {
        int recovered = 0;
        for (var orphan : store.findByStatus(List.of(SessionStatus.STARTING, SessionStatus.RUNNING))) {
            if (live.containsKey(orphan.id())) continue;
            var payload = statusPayload(SessionStatus.ERRORED, orphan.status()).put("reason", "server-restart");
            try {
                appendWithRetry(orphan.id(), EventType.STATUS_CHANGE, payload);
                store.updateStatus(orphan.id(), SessionStatus.ERRORED, clock.instant());
                recovered++;
            } catch (RuntimeException e) {
                log.error("Failed to recover orphaned session {}", orphan.id(), e);
            } finally {
                eventLog.forget(orphan.id());
            }
        }
        for (var errored : store.findByStatus(List.of(SessionStatus.ERRORED))) {
            if (live.containsKey(errored.id())) continue;
            try {
                var last = lastEvent(errored.id());
                if (last.isPresent() && isTerminalStatusChange(last.get())) continue;
                var payload = object()
                        .put("status", SessionStatus.ERRORED.wireName())
                        .put("previous", last.map(RunSessionManager::lastKnownStatus).orElse(SessionStatus.STARTING.wireName()))
                        .put("reason", "persistence-failure");
                appendWithRetry(errored.id(), EventType.STATUS_CHANGE, payload);
                recovered++;
                log.info("Recorded missing terminal status of session {}", errored.id());
            } catch (RuntimeException e) {
                log.error("Failed to record terminal status of session {}", errored.id(), e);
            } finally {
                eventLog.forget(errored.id());
            }
        }
        if (recovered > 0) log.info("Recovered {} sessions left without a terminal status", recovered);
        return recovered;
    }

    private Optional<SessionEvent> lastEvent(String sessionId) {
        long latest = eventLog.latestSeq(sessionId);
        if (latest == 0) return Optional.empty();
        for (var event : eventLog.readFrom(sessionId, latest - 1)) {
            return Optional.of(event);
        }
        return Optional.empty();
    }

    private static boolean isTerminalStatusChange(SessionEvent event) {
        if (event.type() != EventType.STATUS_CHANGE) return false;
        var status = event.payload().path("status").asText();
        return SessionStatus.STOPPED.wireName().equals(status) || SessionStatus.ERRORED.wireName().equals(status);
    }

    private static String lastKnownStatus(SessionEvent event) {
        return event.type() == EventType.STATUS_CHANGE
                ? event.payload().path("status").asText(SessionStatus.RUNNING.wireName())
                : SessionStatus.RUNNING.wireName();
    }

    // --- input ---

    public void sendInput(String sessionId, byte[] data) {
        var session = requireLive(sessionId);
        session.inputLock.lock();
        try {
            RunningProcess process;
            session.lock.lock();
            try {
                requireRunning(session);
                record(session, EventType.STDIN, object().put("data", new String(data, StandardCharsets.UTF_8)));
                process = session.process;
            } catch (RunSessionException e) {
                if (e.reason() == PERSISTENCE_FAILURE) forceErrored(session, e);
                throw e;
            } finally {
                session.lock.unlock();
            }
            try {
                process.write(data);
            } catch (IOException e) {
                var message = "Failed to write to session " + sessionId + ": " + e.getMessage();
                recordProcessFailure(session, message);
                throw new RunSessionException(SESSION_NOT_RUNNING, sessionId, message, e);
            }
        } finally {
            session.inputLock.unlock();
        }
    }

    public void resize(String sessionId, int cols, int rows) {
        if (cols <= 0 || rows <= 0) {
            throw new RunSessionException(INVALID_REQUEST, sessionId, "Invalid size: " + cols + "x" + rows);
        }
        var session = requireLive(sessionId);
        session.inputLock.lock();
        try {
            RunningProcess process;
            session.lock.lock();
            try {
                requireRunning(session);
                if (!session.process.supportsResize()) {
                    throw new RunSessionException(UNSUPPORTED_OPERATION, sessionId,
                            "Sessions of kind " + session.record().kind().wireName() + " cannot be resized");
                }
                record(session, EventType.RESIZE, object().put("cols", cols).put("rows", rows));
                process = session.process;
            } catch (RunSessionException e) {
                if (e.reason() == PERSISTENCE_FAILURE) forceErrored(session, e);
                throw e;
            } finally {
                session.lock.unlock();
            }
            try {
                process.resize(cols, rows);
            } catch (IOException e) {
                var message = "Failed to resize session " + sessionId + ": " + e.getMessage();
                recordProcessFailure(session, message);
                throw new RunSessionException(SESSION_NOT_RUNNING, sessionId, message, e);
            }
        } finally {
            session.inputLock.unlock();
        }
    }

    // the input event is already logged, so the failure is logged after it
    private void recordProcessFailure(LiveSession session, String message) {
        session.lock.lock();
        try {
            if (session.terminal) return;
            record(session, EventType.ERROR, object().put("message", message));
        } catch (RunSessionException e) {
            forceErrored(session, e);
        } finally {
            session.lock.unlock();
        }
        log.warn(message);
    }

    // --- subscriptions ---

    /**
     * Returns the persisted events after {@code afterSeq} and registers {@code listener} for every
     * later event. Together they cover the log without gaps or duplicates. For a session that is no
     * longer live the backlog is the whole remaining log and the subscription is inactive.
     */
    public AttachResult attach(String sessionId, long afterSeq, SessionListener listener) {
        if (afterSeq < 0) {
            throw new RunSessionException(INVALID_REQUEST, sessionId, "afterSeq must not be negative: " + afterSeq);
        }
        var session = live.get(sessionId);
        if (session != null) {
            session.lock.lock();
            try {
                if (live.get(sessionId) == session) {
                    long high = session.lastSeq;
                    var subscription = new Subscription(sessionId, listener, Math.max(high, afterSeq), this::unsubscribe);
                    session.subscribers.add(subscription);
                    log.debug("Attached to session {} after #{} (high-water #{})", sessionId, afterSeq, high);
                    return new AttachResult(session.record(),
                            persisted(sessionId, eventLog.readRange(sessionId, afterSeq, high)),
                            subscription, currentActivity(session));
                }
            } finally {
                session.lock.unlock();
            }
        }
        var stored = findStored(sessionId).orElseThrow(() -> RunSessionException.notFound(sessionId));
        return new AttachResult(stored, persisted(sessionId, eventLog.readFrom(sessionId, afterSeq)),
                Subscription.inactive(sessionId, listener), ActivityState.IDLE);
    }

    /** Read failures surface while iterating, as {@code PERSISTENCE_FAILURE}. */
    private static Iterable<SessionEvent> persisted(String sessionId, Iterable<SessionEvent> events) {
        return () -> {
            Iterator<SessionEvent> it;
            try {
                it = events.iterator();
            } catch (EventLogException e) {
                throw readFailure(sessionId, e);
            }
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    try {
                        return it.hasNext();
                    } catch (EventLogException e) {
                        throw readFailure(sessionId, e);
                    }
                }

                @Override
                public SessionEvent next() {
                    try {
                        return it.next();
                    } catch (EventLogException e) {
                        throw readFailure(sessionId, e);
                    }
                }
            };
        };
    }

    private static RunSessionException readFailure(String sessionId, EventLogException e) {
        return new RunSessionException(PERSISTENCE_FAILURE, sessionId, "Failed to read events of session " + sessionId, e);
    }

    private void unsubscribe(Subscription subscription) {
        var session = live.get(subscription.sessionId());
        if (session == null) return;
        session.lock.lock();
        try {
            session.subscribers.remove(subscription);
            retireIfUnwatched(session);
        } finally {
            session.lock.unlock();
        }
    }

    // --- queries ---

    public ActivityState getActivityState(String sessionId) {
        var session = live.get(sessionId);
        if (session != null) {
            session.lock.lock();
            try {
                return currentActivity(session);
            } finally {
                session.lock.unlock();
            }
        }
        findStored(sessionId).orElseThrow(() -> RunSessionException.notFound(sessionId));
        return ActivityState.IDLE;
    }

    public RunSession get(String sessionId) {
        var session = live.get(sessionId);
        if (session != null) {
            session.lock.lock();
            try {
                return session.record();
            } finally {
                session.lock.unlock();
            }
        }
        return findStored(sessionId).orElseThrow(() -> RunSessionException.notFound(sessionId));
    }

    /** Directory metadata for the session's workspace, as it is on disk now. */
    public WorkspaceInfo describeWorkspace(String sessionId) {
        return directory.describe(Path.of(get(sessionId).workspacePath()));
    }

    public List<SessionSummary> list(SessionKind kind) {
        List<RunSession> stored;
        try {
            stored = store.list(kind);
        } catch (RuntimeException e) {
            throw new RunSessionException(PERSISTENCE_FAILURE, null, "Failed to list sessions", e);
        }
        return stored.stream()
                .map(s -> {
                    var session = live.get(s.id());
                    return session != null ? new SessionSummary(get(s.id()), true) : new SessionSummary(s, false);
                })
                .collect(Collectors.toList());
    }

    /** Persisted events of a known session after {@code afterSeq}. */
    public Iterable<SessionEvent> history(String sessionId, long afterSeq) {
        if (!live.containsKey(sessionId)) {
            findStored(sessionId).orElseThrow(() -> RunSessionException.notFound(sessionId));
        }
        return persisted(sessionId, eventLog.readFrom(sessionId, Math.max(0, afterSeq)));
    }

    public boolean isLive(String sessionId) {
        return live.containsKey(sessionId);
    }

    public RuntimeStats stats() {
        var byKind = new TreeMap<String, Long>();
        for (var session : live.values()) {
            byKind.merge(session.record().kind().wireName(), 1L, Long::sum);
        }
        var kinds = adapters.kinds().stream().map(SessionKind::wireName).sorted().collect(Collectors.toList());
        return new RuntimeStats(live.size(), byKind, kinds);
    }

    // --- adapter events ---

    private void onAdapterEvent(LiveSession session, AdapterEvent event) {
        session.lock.lock();
        try {
            if (session.terminal) {
                log.trace("Dropping {} event for finished session {}", event.type().wireName(), session.id());
                return;
            }
            if (session.status() == SessionStatus.STARTING) {
                session.startBuffer.add(event);
                return;
            }
            applyAdapterEvent(session, event);
        } catch (RunSessionException e) {
            forceErrored(session, e);
        } finally {
            session.lock.unlock();
        }
    }

    // lock held
    private void applyAdapterEvent(LiveSession session, AdapterEvent event) {
        if (session.terminal) return;
        if (event.isExit()) {
            terminate(session, event.exitCode());
        } else {
            record(session, event.type(), event.payload());
        }
    }

    // lock held
    private void terminate(LiveSession session, Integer exitCode) {
        if (session.terminal) return;
        session.terminal = true;
        var previous = session.status();
        session.transition(SessionStatus.STOPPED, clock.instant());
        var payload = statusPayload(SessionStatus.STOPPED, previous)
                .put("reason", session.closing ? "closed" : "exited");
        if (exitCode != null) payload.put("exitCode", exitCode);
        try {
            record(session, EventType.STATUS_CHANGE, payload);
        } catch (RunSessionException e) {
            // recoverOrphans appends the terminal event once the log is reachable again
            session.transition(SessionStatus.ERRORED, clock.instant());
            session.terminalUnrecorded = true;
            log.error("Failed to record terminal status of session {}, marking it errored", session.id(), e);
        }
        updateStoredStatus(session);

        var kind = session.record().kind().wireName();
        if (!session.closing && exitCode != null && exitCode != 0) {
            metrics.adapterCrashes(kind).increment();
            log.warn("Session {} ({}) exited unexpectedly with code {}", session.id(), kind, exitCode);
        } else {
            log.info("Session {} stopped{}", session.id(), exitCode != null ? " with code " + exitCode : "");
        }
        retireIfUnwatched(session);
    }

    // lock held
    private void forceErrored(LiveSession session, RunSessionException cause) {
        if (session.terminal) return;
        log.error("Event log unavailable for session {}, marking it errored", session.id(), cause);
        session.terminal = true;
        var previous = session.status();
        session.transition(SessionStatus.ERRORED, clock.instant());
        try {
            var event = eventLog.append(session.id(), EventType.STATUS_CHANGE,
                    statusPayload(SessionStatus.ERRORED, previous).put("reason", "persistence-failure"));
            session.remember(event);
            dispatch(session, event);
        } catch (EventLogException e) {
            session.terminalUnrecorded = true;
            log.error("Could not record errored status of session {}", session.id(), e);
        }
        updateStoredStatus(session);
        var process = session.process;
        if (process != null) {
            executor.execute(() -> process.stop(config.stopTimeout()));
        }
        retireIfUnwatched(session);
    }

    // lock held
    private void retireIfUnwatched(LiveSession session) {
        if (session.terminal && !session.closing && session.subscribers.isEmpty()) {
            live.remove(session.id(), session);
            eventLog.forget(session.id());
        }
    }

    // lock held
    private SessionEvent record(LiveSession session, EventType type, JsonNode payload) {
        SessionEvent event;
        var sample = Timer.start(metrics.registry());
        try {
            event = appendWithRetry(session.id(), type, payload);
        } catch (RuntimeException e) {
            metrics.persistenceFailures().increment();
            throw new RunSessionException(PERSISTENCE_FAILURE, session.id(),
                    "Failed to persist " + type.wireName() + " event for session " + session.id(), e);
        } finally {
            sample.stop(metrics.appendLatency());
        }
        metrics.eventsAppended().increment();
        session.remember(event);
        dispatch(session, event);
        return event;
    }

    private SessionEvent appendWithRetry(String sessionId, EventType type, JsonNode payload) {
        return ResilientCall.execute(() -> eventLog.append(sessionId, type, payload),
                config.persistenceMaxRetries(), config.persistenceInitialBackoffMs(),
                e -> e instanceof EventLogException);
    }

    // lock held
    private void dispatch(LiveSession session, SessionEvent event) {
        for (var subscription : session.subscribers) {
            if (event.seq() <= subscription.afterSeq()) continue;
            try {
                subscription.listener().onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener of session {} failed on event #{}", session.id(), event.seq(), e);
            }
        }
        publishActivity(session);
    }

    // lock held
    private void publishActivity(LiveSession session) {
        var activity = currentActivity(session);
        if (activity != session.activity) {
            session.activity = activity;
            for (var subscription : session.subscribers) {
                try {
                    subscription.listener().onActivity(session.id(), activity);
                } catch (RuntimeException e) {
                    log.warn("Listener of session {} failed on activity change", session.id(), e);
                }
            }
        }
        // streaming ends by the clock, not by an event
        if (activity == ActivityState.STREAMING && session.record().kind() == SessionKind.SHELL) {
            scheduleActivityCheck(session);
        }
    }

    // lock held
    private void scheduleActivityCheck(LiveSession session) {
        if (session.activityCheckPending) return;
        session.activityCheckPending = true;
        long delayMs = config.streamingWindow().toMillis() + 1;
        CompletableFuture.runAsync(() -> refreshActivity(session),
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor));
    }

    private void refreshActivity(LiveSession session) {
        session.lock.lock();
        try {
            session.activityCheckPending = false;
            if (!session.terminal && live.get(session.id()) == session) publishActivity(session);
        } finally {
            session.lock.unlock();
        }
    }

    // --- helpers ---

    private ActivityState currentActivity(LiveSession session) {
        return ActivityStates.derive(session.record().kind(), session.status(), session.recentEvents(),
                clock.instant(), config.streamingWindow());
    }

    private LiveSession requireLive(String sessionId) {
        var session = live.get(sessionId);
        if (session != null) return session;
        if (findStored(sessionId).isPresent()) throw RunSessionException.notRunning(sessionId);
        throw RunSessionException.notFound(sessionId);
    }

    private static void requireRunning(LiveSession session) {
        if (session.terminal || session.closing || session.status() != SessionStatus.RUNNING) {
            throw RunSessionException.notRunning(session.id());
        }
    }

    private Optional<RunSession> findStored(String sessionId) {
        try {
            return store.find(sessionId);
        } catch (RuntimeException e) {
            throw new RunSessionException(PERSISTENCE_FAILURE, sessionId, "Failed to look up session: " + sessionId, e);
        }
    }

    private void updateStoredStatus(LiveSession session) {
        try {
            store.updateStatus(session.id(), session.status(), session.record().updatedAt());
        } catch (RuntimeException e) {
            log.error("Failed to store status {} of session {}", session.status().wireName(), session.id(), e);
        }
    }

    private static ObjectNode statusPayload(SessionStatus status, SessionStatus previous) {
        return object().put("status", status.wireName()).put("previous", previous.wireName());
    }

    private static ObjectNode object() {
        return JsonNodeFactory.instance.objectNode();
    }
}
