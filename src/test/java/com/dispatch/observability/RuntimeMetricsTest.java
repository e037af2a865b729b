package com.dispatch.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new RuntimeMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.sessionsCreated("shell"));
        assertNotNull(metrics.sessionsFailed("agent"));
        assertNotNull(metrics.eventsAppended());
        assertNotNull(metrics.appendLatency());
        assertNotNull(metrics.persistenceFailures());
        assertNotNull(metrics.adapterCrashes("shell"));
    }

    @Test
    void countersAreTaggedByKind() {
        var registry = new SimpleMeterRegistry();
        var metrics = new RuntimeMetrics(registry);
        metrics.sessionsCreated("shell").increment();
        metrics.sessionsCreated("shell").increment();
        metrics.sessionsCreated("agent").increment();

        assertEquals(2.0, registry.get("dispatch.sessions.created").tag("kind", "shell").counter().count());
        assertEquals(1.0, registry.get("dispatch.sessions.created").tag("kind", "agent").counter().count());
    }

    @Test
    void liveGaugeReadsSupplier() {
        var registry = new SimpleMeterRegistry();
        var live = new AtomicInteger(3);
        new RuntimeMetrics(registry).liveSessions(live::get);

        assertEquals(3.0, registry.get("dispatch.sessions.live").gauge().value());
        live.set(1);
        assertEquals(1.0, registry.get("dispatch.sessions.live").gauge().value());
    }
}
