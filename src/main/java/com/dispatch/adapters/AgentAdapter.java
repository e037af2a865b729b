package com.dispatch.adapters;

import com.dispatch.shared.config.AgentConfig;
import com.dispatch.shared.model.SessionKind;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

/**
 * Drives a coding-agent CLI. Every prompt written to the session is one turn: the configured
 * command runs in the workspace with the prompt on stdin, and its stream-json output is mapped
 * to events. Options: {@code model}, {@code resume} (an agent conversation id to continue).
 */
public class AgentAdapter implements ProcessAdapter {

    private final AgentConfig config;
    private final ExecutorService io;

    public AgentAdapter(AgentConfig config, ExecutorService io) {
        this.config = config;
        this.io = io;
    }

    @Override
    public SessionKind kind() {
        return SessionKind.AGENT;
    }

    @Override
    public RunningProcess start(StartRequest request, EventSink sink) throws IOException {
        if (config.command().isEmpty()) {
            throw new IllegalArgumentException("Agent command is not configured");
        }
        var executable = config.command().get(0);
        if (Executables.resolve(executable).isEmpty()) {
            throw new IOException("Agent executable not found: " + executable);
        }
        return new AgentSession(config, request, sink, io);
    }
}
