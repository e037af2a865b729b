package com.dispatch.shared.config;

import java.time.Duration;

public record RuntimeConfig(
    Duration startTimeout,
    Duration stopTimeout,
    int persistenceMaxRetries,
    long persistenceInitialBackoffMs,
    Duration streamingWindow,
    int readPageSize
) {
    public static RuntimeConfig defaults() {
        return new RuntimeConfig(Duration.ofSeconds(10), Duration.ofSeconds(5), 3, 50,
                Duration.ofMillis(1500), 500);
    }
}
