package com.dispatch.adapters;

import com.dispatch.shared.model.SessionKind;

import java.io.IOException;

/**
 * Starts the underlying process for one session kind. Everything the process produces after
 * {@link #start} returns, including its death, reaches the caller only through the sink.
 */
public interface ProcessAdapter {

    SessionKind kind();

    /**
     * @throws IOException              when the binary is missing or the spawn is rejected
     * @throws IllegalArgumentException when the options are malformed
     */
    RunningProcess start(StartRequest request, EventSink sink) throws IOException;
}
