package com.dispatch.shared.config;

import java.util.List;

/**
 * How the agent CLI is invoked for each turn. {@code command} is the full argv prefix;
 * the prompt is written to the process stdin.
 */
public record AgentConfig(
    List<String> command,
    String resumeFlag,
    String modelFlag,
    long turnTimeoutSeconds
) {
    public static AgentConfig defaults() {
        return new AgentConfig(
            List.of("claude", "-p", "--output-format", "stream-json", "--verbose"),
            "--resume", "--model", 1800);
    }
}
