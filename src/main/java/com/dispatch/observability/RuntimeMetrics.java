package com.dispatch.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class RuntimeMetrics {

    private final MeterRegistry registry;

    public RuntimeMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RuntimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter sessionsCreated(String kind) {
        return Counter.builder("dispatch.sessions.created").tag("kind", kind).register(registry);
    }

    public Counter sessionsFailed(String kind) {
        return Counter.builder("dispatch.sessions.failed").tag("kind", kind).register(registry);
    }

    public Counter eventsAppended() {
        return Counter.builder("dispatch.events.appended").register(registry);
    }

    public Timer appendLatency() {
        return Timer.builder("dispatch.events.append.latency").register(registry);
    }

    public Counter persistenceFailures() {
        return Counter.builder("dispatch.persistence.failures").register(registry);
    }

    public Counter adapterCrashes(String kind) {
        return Counter.builder("dispatch.adapter.crashes").tag("kind", kind).register(registry);
    }

    public void liveSessions(Supplier<Number> count) {
        Gauge.builder("dispatch.sessions.live", count).register(registry);
    }
}
