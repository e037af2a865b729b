package com.dispatch.gateway.ws;

import com.dispatch.sessions.CreateRequest;
import com.dispatch.shared.model.SessionKind;
import com.dispatch.testing.TestRuntime;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RunSessionSocketHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path workspaces;

    private TestRuntime runtime;
    private RunSessionSocketHandler handler;
    private WebSocketSession socket;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectory(workspaces.resolve("app"));
        runtime = new TestRuntime(workspaces);
        handler = new RunSessionSocketHandler(runtime.manager, MAPPER, Runnable::run);
        socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn("client-1");
        when(socket.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(socket);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void createAcksWithSessionId() throws Exception {
        send("{\"type\":\"create\",\"requestId\":\"r1\",\"kind\":\"shell\",\"workspacePath\":\"app\",\"sessionId\":\"s-1\"}");

        var ack = sent().get(0);
        assertEquals("ack", ack.path("type").asText());
        assertEquals("r1", ack.path("requestId").asText());
        assertEquals("s-1", ack.path("sessionId").asText());
        assertTrue(runtime.manager.isLive("s-1"));
    }

    @Test
    void attachReplaysBacklogThenStreamsLiveEvents() throws Exception {
        var id = create();
        runtime.manager.sendInput(id, "one\n".getBytes(StandardCharsets.UTF_8));

        send("{\"type\":\"attach\",\"requestId\":\"a1\",\"sessionId\":\"" + id + "\",\"afterSeq\":0}");
        send("{\"type\":\"input\",\"sessionId\":\"" + id + "\",\"data\":\"two\\n\"}");

        var frames = sent();
        assertEquals(List.of("ack", "event", "event", "event", "status"), types(frames).subList(0, 5));
        var ack = frames.get(0);
        assertEquals("a1", ack.path("requestId").asText());
        assertEquals("running", ack.path("session").path("status").asText());
        var events = frames.stream()
                .filter(f -> "event".equals(f.path("type").asText()))
                .map(f -> f.path("event"))
                .collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L),
                events.stream().map(e -> e.path("seq").asLong()).collect(Collectors.toList()));
        var live = events.get(4);
        assertEquals("stdout", live.path("type").asText());
        assertEquals("two\n", live.path("payload").path("data").asText());
        assertEquals(id, live.path("sessionId").asText());
        assertTrue(live.path("timestamp").isNumber());
    }

    @Test
    void attachAfterSeqSkipsSeenEvents() throws Exception {
        var id = create();
        runtime.manager.sendInput(id, "one\n".getBytes(StandardCharsets.UTF_8));

        send("{\"type\":\"attach\",\"sessionId\":\"" + id + "\",\"afterSeq\":2}");

        var events = sent().stream().filter(f -> "event".equals(f.path("type").asText())).collect(Collectors.toList());
        assertEquals(1, events.size());
        assertEquals(3, events.get(0).path("event").path("seq").asLong());
    }

    @Test
    void inputAcksOnlyWhenRequested() throws Exception {
        var id = create();

        send("{\"type\":\"input\",\"sessionId\":\"" + id + "\",\"data\":\"ls\\n\"}");
        assertTrue(sent().isEmpty());

        send("{\"type\":\"input\",\"requestId\":\"i2\",\"sessionId\":\"" + id + "\",\"data\":\"ls\\n\"}");
        var frames = sent();
        assertEquals(1, frames.size());
        assertEquals("i2", frames.get(0).path("requestId").asText());
    }

    @Test
    void detachStopsDelivery() throws Exception {
        var id = create();
        send("{\"type\":\"attach\",\"sessionId\":\"" + id + "\"}");
        send("{\"type\":\"detach\",\"requestId\":\"d1\",\"sessionId\":\"" + id + "\"}");
        int before = sent().size();

        runtime.manager.sendInput(id, "quiet\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(before, sent().size());
        assertEquals("ack", last().path("type").asText());
        assertEquals("d1", last().path("requestId").asText());
    }

    @Test
    void attachToClosedSessionReplaysHistoryOnly() throws Exception {
        var id = create();
        runtime.manager.close(id);

        send("{\"type\":\"attach\",\"sessionId\":\"" + id + "\"}");

        var frames = sent();
        assertEquals(List.of("ack", "event", "event", "status"), types(frames));
        assertEquals("stopped", frames.get(0).path("session").path("status").asText());
        assertEquals("idle", last().path("activityState").asText());
    }

    @Test
    void failuresBecomeErrorFrames() throws Exception {
        var id = create();

        send("not json");
        send("{\"type\":\"bogus\",\"requestId\":\"b1\"}");
        send("{\"type\":\"input\",\"requestId\":\"x1\",\"sessionId\":\"missing\",\"data\":\"hi\"}");
        send("{\"type\":\"resize\",\"requestId\":\"x2\",\"sessionId\":\"" + id + "\",\"cols\":100,\"rows\":30}");
        send("{\"type\":\"create\",\"requestId\":\"x3\",\"kind\":\"robot\",\"workspacePath\":\"app\"}");
        send("{\"type\":\"attach\",\"requestId\":\"x4\"}");

        var frames = sent();
        assertEquals(6, frames.size());
        assertTrue(frames.stream().allMatch(f -> "error".equals(f.path("type").asText())));
        assertEquals("Malformed frame", frames.get(0).path("message").asText());
        assertEquals("INVALID_REQUEST", frames.get(0).path("code").asText());
        assertEquals("Unknown frame type: bogus", frames.get(1).path("message").asText());
        assertEquals("b1", frames.get(1).path("requestId").asText());
        assertEquals("SESSION_NOT_FOUND", frames.get(2).path("code").asText());
        assertEquals("x1", frames.get(2).path("requestId").asText());
        assertEquals("UNSUPPORTED_OPERATION", frames.get(3).path("code").asText());
        assertEquals("INVALID_REQUEST", frames.get(4).path("code").asText());
        assertEquals("INVALID_REQUEST", frames.get(5).path("code").asText());
    }

    @Test
    void unreadableBacklogEndsAttachWithErrorFrame() throws Exception {
        var id = create();

        runtime.events.setDown(true);
        send("{\"type\":\"attach\",\"requestId\":\"a1\",\"sessionId\":\"" + id + "\"}");
        runtime.events.setDown(false);

        assertEquals(List.of("ack", "error"), types(sent()));
        assertEquals("PERSISTENCE_FAILURE", last().path("code").asText());
        assertEquals("a1", last().path("requestId").asText());

        int before = sent().size();
        runtime.manager.sendInput(id, "after\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(before, sent().size());
        assertTrue(runtime.manager.isLive(id));
    }

    @Test
    void slowClientDoesNotHoldUpTheSession() throws Exception {
        var release = new CountDownLatch(1);
        var sender = Executors.newSingleThreadExecutor();
        var slowHandler = new RunSessionSocketHandler(runtime.manager, MAPPER, sender);
        var slow = mock(WebSocketSession.class);
        when(slow.getId()).thenReturn("slow-1");
        when(slow.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            release.await();
            return null;
        }).when(slow).sendMessage(any());
        try {
            slowHandler.afterConnectionEstablished(slow);
            var id = create();
            slowHandler.handleTextMessage(slow, new TextMessage("{\"type\":\"attach\",\"sessionId\":\"" + id + "\"}"));

            CompletableFuture.runAsync(() -> runtime.manager.sendInput(id, "x\n".getBytes(StandardCharsets.UTF_8)))
                    .get(2, TimeUnit.SECONDS);

            release.countDown();
            verify(slow, timeout(5000).atLeast(5)).sendMessage(any());
        } finally {
            release.countDown();
            slowHandler.shutdown();
        }
    }

    @Test
    void activityRequestAnswersWithStatus() throws Exception {
        var id = create();

        send("{\"type\":\"activity\",\"sessionId\":\"" + id + "\"}");

        assertEquals("status", last().path("type").asText());
        assertEquals(id, last().path("sessionId").asText());
        assertEquals("idle", last().path("activityState").asText());
    }

    @Test
    void closeFrameStopsSessionAndNotifiesAttachedClient() throws Exception {
        var id = create();
        send("{\"type\":\"attach\",\"sessionId\":\"" + id + "\"}");

        send("{\"type\":\"close\",\"requestId\":\"c1\",\"sessionId\":\"" + id + "\"}");

        var frames = sent();
        var terminal = frames.get(frames.size() - 2).path("event");
        assertEquals("status-change", terminal.path("type").asText());
        assertEquals("stopped", terminal.path("payload").path("status").asText());
        assertEquals("c1", last().path("requestId").asText());
        assertFalse(runtime.manager.isLive(id));
    }

    @Test
    void disconnectDetachesEverySession() throws Exception {
        var id = create();
        send("{\"type\":\"attach\",\"sessionId\":\"" + id + "\"}");

        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);

        assertEquals(0, handler.connectionCount());
        runtime.manager.sendInput(id, "x\n".getBytes(StandardCharsets.UTF_8));
        runtime.manager.close(id);
        assertFalse(runtime.manager.isLive(id));
    }

    private String create() {
        return runtime.manager.create(new CreateRequest(null, SessionKind.SHELL, "app", Map.of()));
    }

    private void send(String payload) throws Exception {
        handler.handleTextMessage(socket, new TextMessage(payload));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<JsonNode> sent() throws Exception {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(socket, atLeast(0)).sendMessage(captor.capture());
        var frames = new ArrayList<JsonNode>();
        for (var message : captor.getAllValues()) {
            frames.add(MAPPER.readTree(((TextMessage) message).getPayload()));
        }
        return frames;
    }

    private JsonNode last() throws Exception {
        var frames = sent();
        return frames.get(frames.size() - 1);
    }

    private static List<String> types(List<JsonNode> frames) {
        return frames.stream().map(f -> f.path("type").asText()).collect(Collectors.toList());
    }
}
