package com.dispatch.adapters;

import com.dispatch.shared.config.AgentConfig;
import com.dispatch.shared.model.EventType;
import com.dispatch.testing.Waits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class AgentAdapterTest {

    private static final String HAPPY_AGENT = String.join("\n",
            "prompt=$(cat)",
            "echo '{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"conv-123\"}'",
            "printf '{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"got: %s\"}]}}\\n' \"$prompt\"",
            "echo \"args: $*\"",
            "echo '{\"type\":\"result\",\"is_error\":false,\"result\":\"done\",\"session_id\":\"conv-123\"}'",
            "");

    private static final String HANGING_AGENT = String.join("\n",
            "cat > /dev/null",
            "sleep 30",
            "");

    private static final String FAILING_AGENT = String.join("\n",
            "cat > /dev/null",
            "echo 'model overloaded' >&2",
            "exit 3",
            "");

    @TempDir
    Path workspace;

    private final ExecutorService io = Executors.newCachedThreadPool();
    private final List<AdapterEvent> events = new CopyOnWriteArrayList<>();
    private final List<AgentSession> started = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        started.forEach(s -> s.stop(Duration.ofSeconds(1)));
        io.shutdownNow();
    }

    @Test
    void turnOutputIsMappedToEvents() throws Exception {
        var session = start(HAPPY_AGENT, Map.of());

        session.write("hello agent".getBytes(StandardCharsets.UTF_8));
        awaitTurnEnd();

        assertEquals("turn-start", events.get(0).payload().path("phase").asText());
        assertTrue(stdoutTexts().contains("got: hello agent"));
        var end = events.get(events.size() - 1).payload();
        assertEquals("turn-end", end.path("phase").asText());
        assertEquals("done", end.path("result").asText());
        assertEquals("conv-123", session.conversationId());
    }

    @Test
    void laterTurnsResumeTheConversation() throws Exception {
        var session = start(HAPPY_AGENT, Map.of("model", "sonnet"));

        session.write("first".getBytes(StandardCharsets.UTF_8));
        awaitTurnEnd();
        events.clear();
        session.write("second".getBytes(StandardCharsets.UTF_8));
        awaitTurnEnd();

        assertTrue(stdoutTexts().stream().anyMatch(t -> t.equals("args: --model sonnet --resume conv-123")),
                "unexpected output " + stdoutTexts());
    }

    @Test
    void resumeOptionSeedsConversation() throws Exception {
        var session = start(HAPPY_AGENT, Map.of("resume", "prior-7"));

        var command = session.commandFor();

        assertEquals(List.of("--resume", "prior-7"), command.subList(command.size() - 2, command.size()));
        session.stop(Duration.ofSeconds(1));
    }

    @Test
    void failedTurnReportsStderrAndError() throws Exception {
        var session = start(FAILING_AGENT, Map.of());

        session.write("anything".getBytes(StandardCharsets.UTF_8));
        awaitTurnEnd();

        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.STDERR
                && "model overloaded".equals(e.payload().path("text").asText())));
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.ERROR
                && "Agent exited with code 3".equals(e.payload().path("message").asText())));
        assertTrue(events.get(events.size() - 1).payload().path("isError").asBoolean());
        assertTrue(session.isAlive());
    }

    @Test
    void hungTurnIsKilledAfterTurnTimeout() throws Exception {
        var session = start(HANGING_AGENT, Map.of(), 1);

        long began = System.nanoTime();
        session.write("anything".getBytes(StandardCharsets.UTF_8));
        awaitTurnEnd();

        assertTrue(Duration.ofNanos(System.nanoTime() - began).compareTo(Duration.ofSeconds(10)) < 0);
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.ERROR
                && "Agent turn timed out after 1s".equals(e.payload().path("message").asText())));
        var end = events.get(events.size() - 1).payload();
        assertEquals("turn-end", end.path("phase").asText());
        assertEquals("timeout", end.path("result").asText());
        assertTrue(session.isAlive());
    }

    @Test
    void blankPromptIsIgnored() throws Exception {
        var session = start(HAPPY_AGENT, Map.of());

        session.write("   ".getBytes(StandardCharsets.UTF_8));
        session.stop(Duration.ofSeconds(1));

        assertEquals(1, events.size());
        assertTrue(events.get(0).isExit());
    }

    @Test
    void stopReportsExitOnceAndRejectsInput() throws Exception {
        var session = start(HAPPY_AGENT, Map.of());

        session.stop(Duration.ofSeconds(1));
        session.stop(Duration.ofSeconds(1));

        assertEquals(1, events.stream().filter(AdapterEvent::isExit).count());
        assertFalse(session.isAlive());
        assertThrows(IOException.class, () -> session.write("late".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void missingExecutableFailsToStart() {
        var config = new AgentConfig(List.of("definitely-not-an-agent-cli-xyz"), "--resume", "--model", 30);
        var adapter = new AgentAdapter(config, io);

        assertThrows(IOException.class, () -> adapter.start(request(Map.of()), events::add));
    }

    @Test
    void emptyCommandIsRejected() {
        var config = new AgentConfig(List.of(), "--resume", "--model", 30);
        var adapter = new AgentAdapter(config, io);

        assertThrows(IllegalArgumentException.class, () -> adapter.start(request(Map.of()), events::add));
    }

    private AgentSession start(String script, Map<String, Object> options) throws IOException {
        return start(script, options, 30);
    }

    private AgentSession start(String script, Map<String, Object> options, long turnTimeoutSeconds) throws IOException {
        var file = workspace.resolve("fake-agent.sh");
        Files.writeString(file, script);
        var config = new AgentConfig(List.of("/bin/sh", file.toString()), "--resume", "--model", turnTimeoutSeconds);
        var session = (AgentSession) new AgentAdapter(config, io).start(request(options), events::add);
        started.add(session);
        return session;
    }

    private StartRequest request(Map<String, Object> options) {
        return new StartRequest("agent-test-1", workspace, options);
    }

    private void awaitTurnEnd() {
        Waits.until(() -> events.stream().anyMatch(e -> e.type() == EventType.TOOL_ACTIVITY
                && "turn-end".equals(e.payload().path("phase").asText())), Duration.ofSeconds(10), "turn end");
    }

    private List<String> stdoutTexts() {
        return events.stream()
                .filter(e -> e.type() == EventType.STDOUT)
                .map(e -> e.payload().path("text").asText())
                .collect(Collectors.toList());
    }
}
