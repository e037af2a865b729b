package com.dispatch.shared.config;

public record RetentionConfig(
    boolean enabled,
    int maxAgeDays,
    long intervalMinutes
) {
    public static RetentionConfig defaults() {
        return new RetentionConfig(true, 30, 60);
    }
}
