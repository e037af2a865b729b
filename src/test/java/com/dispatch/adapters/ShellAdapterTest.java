package com.dispatch.adapters;

import com.dispatch.shared.config.ShellConfig;
import com.dispatch.shared.model.EventType;
import com.dispatch.testing.Waits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellAdapterTest {

    @TempDir
    Path workspace;

    private final ExecutorService readers = Executors.newCachedThreadPool();
    private final List<AdapterEvent> events = new CopyOnWriteArrayList<>();
    private final ShellAdapter adapter = new ShellAdapter(new ShellConfig("/bin/sh", List.of(), 80, 24), readers);
    private RunningProcess process;

    @AfterEach
    void tearDown() {
        if (process != null) process.stop(Duration.ofSeconds(2));
        readers.shutdownNow();
    }

    @Test
    void shellOutputIsStreamed() throws Exception {
        process = adapter.start(request(Map.of()), events::add);

        process.write("echo $((6*7))\n".getBytes(StandardCharsets.UTF_8));

        Waits.until(() -> output().contains("42"), Duration.ofSeconds(10), "shell output");
        assertTrue(process.isAlive());
        assertTrue(process.supportsResize());
    }

    @Test
    void shellRunsInWorkspace() throws Exception {
        process = adapter.start(request(Map.of()), events::add);

        process.write("pwd\n".getBytes(StandardCharsets.UTF_8));

        var name = workspace.getFileName().toString();
        Waits.until(() -> output().contains(name), Duration.ofSeconds(10), "working directory");
    }

    @Test
    void exitIsReportedAfterOutput() throws Exception {
        process = adapter.start(request(Map.of()), events::add);

        process.write("exit 5\n".getBytes(StandardCharsets.UTF_8));

        Waits.until(() -> events.stream().anyMatch(AdapterEvent::isExit), Duration.ofSeconds(10), "exit");
        var last = events.get(events.size() - 1);
        assertTrue(last.isExit());
        assertEquals(5, last.exitCode());
        assertEquals(1, events.stream().filter(AdapterEvent::isExit).count());
    }

    @Test
    void stopTerminatesAndReportsExit() throws Exception {
        process = adapter.start(request(Map.of("cols", 120, "rows", 40)), events::add);
        process.resize(100, 30);

        process.stop(Duration.ofSeconds(2));

        assertFalse(process.isAlive());
        Waits.until(() -> events.stream().anyMatch(AdapterEvent::isExit), Duration.ofSeconds(5), "exit");
        assertTrue(events.stream().allMatch(e -> e.type() == EventType.STDOUT || e.isExit()));
    }

    @Test
    void missingShellFailsToStart() {
        var ex = assertThrows(IOException.class,
                () -> adapter.start(request(Map.of("shell", "/no/such/shell")), events::add));
        assertTrue(ex.getMessage().contains("/no/such/shell"));
    }

    @Test
    void malformedSizeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> adapter.start(request(Map.of("cols", "wide")), events::add));
    }

    @Test
    void sizesAreClamped() {
        assertEquals(10, ShellAdapter.clamp(1, ShellAdapter.MIN_COLS, ShellAdapter.MAX_COLS));
        assertEquals(500, ShellAdapter.clamp(9000, ShellAdapter.MIN_COLS, ShellAdapter.MAX_COLS));
        assertEquals(24, ShellAdapter.clamp(24, ShellAdapter.MIN_ROWS, ShellAdapter.MAX_ROWS));
    }

    private StartRequest request(Map<String, Object> options) {
        return new StartRequest("shell-test-1", workspace, options);
    }

    private String output() {
        var sb = new StringBuilder();
        for (var e : events) {
            if (e.type() == EventType.STDOUT) sb.append(e.payload().path("data").asText());
        }
        return sb.toString();
    }
}
