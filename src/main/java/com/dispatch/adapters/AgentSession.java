package com.dispatch.adapters;

import com.dispatch.shared.config.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One agent session. Turns run one at a time on a dedicated thread, in the order the prompts
 * were written.
 */
class AgentSession implements RunningProcess {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);

    private final AgentConfig config;
    private final StartRequest request;
    private final EventSink sink;
    private final ExecutorService io;
    private final ExecutorService turns;
    private final AgentStreamParser parser = new AgentStreamParser();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile String conversationId;
    private volatile Process current;

    AgentSession(AgentConfig config, StartRequest request, EventSink sink, ExecutorService io) {
        this.config = config;
        this.request = request;
        this.sink = sink;
        this.io = io;
        this.conversationId = request.stringOption("resume", null);
        this.turns = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory("agent-" + shortId(request.sessionId()) + "-"));
    }

    @Override
    public void write(byte[] data) throws IOException {
        if (stopped.get()) throw new IOException("Agent session is stopped");
        var prompt = new String(data, StandardCharsets.UTF_8);
        if (prompt.isBlank()) return;
        try {
            turns.submit(() -> runTurn(prompt));
        } catch (RejectedExecutionException e) {
            throw new IOException("Agent session is stopped", e);
        }
    }

    List<String> commandFor() {
        var cmd = new ArrayList<>(config.command());
        var model = request.stringOption("model", null);
        if (model != null) {
            cmd.add(config.modelFlag());
            cmd.add(model);
        }
        if (conversationId != null) {
            cmd.add(config.resumeFlag());
            cmd.add(conversationId);
        }
        return cmd;
    }

    private void runTurn(String prompt) {
        if (stopped.get()) return;
        sink.emit(AdapterEvent.toolActivity(AdapterEvent.object().put("phase", "turn-start")));

        var pb = new ProcessBuilder(commandFor());
        pb.directory(request.workspace().toFile());
        pb.redirectErrorStream(false);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[agent:{}] failed to start turn: {}", request.sessionId(), e.getMessage());
            sink.emit(AdapterEvent.error("Failed to start agent turn: " + e.getMessage()));
            sink.emit(turnEnd("spawn failed"));
            return;
        }
        current = process;
        var timedOut = new AtomicBoolean();
        var deadline = CompletableFuture.runAsync(() -> {
            if (!process.isAlive()) return;
            timedOut.set(true);
            log.warn("[agent:{}] turn exceeded {}s, killing it", request.sessionId(), config.turnTimeoutSeconds());
            kill(process);
        }, CompletableFuture.delayedExecutor(config.turnTimeoutSeconds(), TimeUnit.SECONDS, io));
        try {
            var stderr = CompletableFuture.runAsync(() -> drainStderr(process), io);
            try (var stdin = process.getOutputStream()) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            }
            boolean sawResult = readStdout(process);
            process.waitFor();
            stderr.join();
            if (timedOut.get() && !sawResult) {
                emitTimeout();
            } else if (!sawResult) {
                if (stopped.get()) {
                    sink.emit(turnEnd("cancelled"));
                } else if (process.exitValue() != 0) {
                    sink.emit(AdapterEvent.error("Agent exited with code " + process.exitValue()));
                    sink.emit(turnEnd("exit " + process.exitValue()));
                } else {
                    sink.emit(AdapterEvent.toolActivity(AdapterEvent.object()
                            .put("phase", "turn-end").put("isError", false)));
                }
            }
        } catch (IOException e) {
            if (timedOut.get()) {
                emitTimeout();
                return;
            }
            if (!stopped.get()) {
                log.warn("[agent:{}] turn failed: {}", request.sessionId(), e.getMessage());
                sink.emit(AdapterEvent.error("Agent turn failed: " + e.getMessage()));
            }
            sink.emit(turnEnd("io error"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
        } finally {
            deadline.cancel(false);
            current = null;
        }
    }

    private void emitTimeout() {
        sink.emit(AdapterEvent.error("Agent turn timed out after " + config.turnTimeoutSeconds() + "s"));
        sink.emit(turnEnd("timeout"));
    }

    // children may hold stdout open after the CLI itself dies
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private boolean readStdout(Process process) throws IOException {
        boolean sawResult = false;
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                var parsed = parser.parse(line);
                if (parsed.conversationId() != null) conversationId = parsed.conversationId();
                parsed.events().forEach(sink::emit);
                sawResult |= parsed.turnEnded();
            }
        }
        return sawResult;
    }

    private void drainStderr(Process process) {
        try (var err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = err.readLine()) != null) {
                if (!line.isBlank()) sink.emit(AdapterEvent.stderrText(line));
            }
        } catch (IOException e) {
            log.debug("[agent:{}] stderr closed: {}", request.sessionId(), e.getMessage());
        }
    }

    private static AdapterEvent turnEnd(String reason) {
        return AdapterEvent.toolActivity(AdapterEvent.object()
                .put("phase", "turn-end").put("isError", true).put("result", reason));
    }

    @Override
    public void stop(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) return;
        turns.shutdownNow();
        var running = current;
        if (running != null) running.destroy();
        try {
            if (!turns.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[agent:{}] turn did not finish within {}ms, killing", request.sessionId(), timeout.toMillis());
                running = current;
                if (running != null) kill(running);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sink.emit(AdapterEvent.exited(0));
    }

    @Override
    public boolean isAlive() {
        return !stopped.get();
    }

    String conversationId() {
        return conversationId;
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
