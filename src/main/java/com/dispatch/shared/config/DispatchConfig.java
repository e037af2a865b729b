package com.dispatch.shared.config;

public record DispatchConfig(
    String workspacesRoot,
    RuntimeConfig runtime,
    ShellConfig shell,
    AgentConfig agent,
    RetentionConfig retention
) {
    public static DispatchConfig defaults() {
        return new DispatchConfig(System.getProperty("user.home"), RuntimeConfig.defaults(),
                ShellConfig.defaults(), AgentConfig.defaults(), RetentionConfig.defaults());
    }
}
