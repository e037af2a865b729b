package com.dispatch.sessions;

import com.dispatch.eventlog.EventLog;
import com.dispatch.shared.config.RetentionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deletes the events and records of sessions that have been finished for longer than the
 * configured age. Live sessions are never touched.
 */
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final SessionStore store;
    private final EventLog eventLog;
    private final RunSessionManager manager;
    private final RetentionConfig config;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public RetentionService(SessionStore store, EventLog eventLog, RunSessionManager manager,
                            RetentionConfig config, Clock clock) {
        this.store = store;
        this.eventLog = eventLog;
        this.manager = manager;
        this.config = config;
        this.clock = clock;
    }

    public synchronized void start() {
        if (!config.enabled() || scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("retention-"));
        scheduler.scheduleAtFixedRate(this::purgeSafely, config.intervalMinutes(), config.intervalMinutes(),
                TimeUnit.MINUTES);
        log.info("Retention enabled: sessions finished more than {} days ago are purged every {} minutes",
                config.maxAgeDays(), config.intervalMinutes());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    public int purge() {
        var cutoff = clock.instant().minus(Duration.ofDays(config.maxAgeDays()));
        int purged = 0;
        for (var session : store.findTerminalBefore(cutoff)) {
            if (manager.isLive(session.id())) continue;
            int events = eventLog.deleteSession(session.id());
            store.delete(session.id());
            log.debug("Purged session {} with {} events", session.id(), events);
            purged++;
        }
        if (purged > 0) log.info("Retention purged {} sessions finished before {}", purged, cutoff);
        return purged;
    }

    private void purgeSafely() {
        try {
            purge();
        } catch (RuntimeException e) {
            log.error("Retention run failed", e);
        }
    }
}
