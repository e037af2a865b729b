package com.dispatch.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".dispatch", "config.yaml"
    );

    public static DispatchConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static DispatchConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var workspaces = (Map<String, Object>) raw.getOrDefault("workspaces", Map.of());
        var runtime = (Map<String, Object>) raw.getOrDefault("runtime", Map.of());
        var shell = (Map<String, Object>) raw.getOrDefault("shell", Map.of());
        var agent = (Map<String, Object>) raw.getOrDefault("agent", Map.of());
        var retention = (Map<String, Object>) raw.getOrDefault("retention", Map.of());

        return new DispatchConfig(
            envOrDefault("DISPATCH_WORKSPACES_ROOT",
                String.valueOf(workspaces.getOrDefault("root", System.getProperty("user.home")))),
            parseRuntimeConfig(runtime),
            parseShellConfig(shell),
            parseAgentConfig(agent),
            parseRetentionConfig(retention)
        );
    }

    @SuppressWarnings("unchecked")
    private static RuntimeConfig parseRuntimeConfig(Map<String, Object> runtime) {
        var defaults = RuntimeConfig.defaults();
        var persistence = (Map<String, Object>) runtime.getOrDefault("persistence", Map.of());
        return new RuntimeConfig(
            Duration.ofMillis(longValue(runtime, "start-timeout-ms", defaults.startTimeout().toMillis())),
            Duration.ofMillis(longValue(runtime, "stop-timeout-ms", defaults.stopTimeout().toMillis())),
            (int) longValue(persistence, "max-retries", defaults.persistenceMaxRetries()),
            longValue(persistence, "initial-backoff-ms", defaults.persistenceInitialBackoffMs()),
            Duration.ofMillis(longValue(runtime, "streaming-window-ms", defaults.streamingWindow().toMillis())),
            (int) longValue(runtime, "read-page-size", defaults.readPageSize())
        );
    }

    @SuppressWarnings("unchecked")
    private static ShellConfig parseShellConfig(Map<String, Object> shell) {
        var defaults = ShellConfig.defaults();
        return new ShellConfig(
            String.valueOf(shell.getOrDefault("default", defaults.defaultShell())),
            stringList(shell.getOrDefault("args", defaults.args())),
            (int) longValue(shell, "cols", defaults.cols()),
            (int) longValue(shell, "rows", defaults.rows())
        );
    }

    private static AgentConfig parseAgentConfig(Map<String, Object> agent) {
        var defaults = AgentConfig.defaults();
        var envCommand = System.getenv("DISPATCH_AGENT_COMMAND");
        var command = envCommand != null && !envCommand.isBlank()
                ? Arrays.asList(envCommand.trim().split("\\s+"))
                : stringList(agent.getOrDefault("command", defaults.command()));
        return new AgentConfig(
            List.copyOf(command),
            String.valueOf(agent.getOrDefault("resume-flag", defaults.resumeFlag())),
            String.valueOf(agent.getOrDefault("model-flag", defaults.modelFlag())),
            longValue(agent, "turn-timeout", defaults.turnTimeoutSeconds())
        );
    }

    private static RetentionConfig parseRetentionConfig(Map<String, Object> retention) {
        var defaults = RetentionConfig.defaults();
        return new RetentionConfig(
            Boolean.parseBoolean(String.valueOf(retention.getOrDefault("enabled", defaults.enabled()))),
            (int) longValue(retention, "max-age-days", defaults.maxAgeDays()),
            longValue(retention, "interval-minutes", defaults.intervalMinutes())
        );
    }

    private static long longValue(Map<String, Object> section, String key, long fallback) {
        return Long.parseLong(String.valueOf(section.getOrDefault(key, fallback)));
    }

    private static List<String> stringList(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return Arrays.asList(String.valueOf(value).trim().split("\\s+"));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
