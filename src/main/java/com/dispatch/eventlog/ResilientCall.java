package com.dispatch.eventlog;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

public class ResilientCall {

    private static final long MAX_BACKOFF_MS = 2_000;

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        return execute(action, maxRetries, baseDelayMs, e -> true);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs,
                                Predicate<Exception> retryable) {
        Exception last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e)) break;
                if (attempt < maxRetries) {
                    sleep(delay);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw new RetriesExhaustedException(last);
    }

    static long maxBackoffMs() {
        return MAX_BACKOFF_MS;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during retry", ie);
        }
    }

    public static class RetriesExhaustedException extends RuntimeException {
        RetriesExhaustedException(Exception last) {
            super("All retries exhausted", last);
        }
    }
}
