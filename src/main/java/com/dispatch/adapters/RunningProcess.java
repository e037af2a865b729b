package com.dispatch.adapters;

import java.io.IOException;
import java.time.Duration;

public interface RunningProcess {

    void write(byte[] data) throws IOException;

    default boolean supportsResize() {
        return false;
    }

    default void resize(int cols, int rows) throws IOException {
        throw new UnsupportedOperationException("resize is not supported by this process");
    }

    /**
     * Terminates the process, killing it if it has not exited within {@code timeout}. The exit
     * is reported through the sink before this returns unless the process could not be reaped.
     */
    void stop(Duration timeout);

    boolean isAlive();
}
