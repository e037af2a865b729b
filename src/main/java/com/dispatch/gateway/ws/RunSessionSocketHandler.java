package com.dispatch.gateway.ws;

import com.dispatch.sessions.AttachResult;
import com.dispatch.sessions.CreateRequest;
import com.dispatch.sessions.RunSessionException;
import com.dispatch.sessions.RunSessionManager;
import com.dispatch.shared.model.SessionKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON duplex protocol over one WebSocket, multiplexed by session id.
 * Client frames: attach, detach, input, resize, create, close, activity.
 * Server frames: event, status, ack, error.
 */
@Component
public class RunSessionSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RunSessionSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 1024 * 1024;
    private static final TypeReference<Map<String, Object>> OPTIONS = new TypeReference<>() {};

    private final RunSessionManager manager;
    private final ObjectMapper mapper;
    private final ProtocolMessages messages;
    private final Executor sender;
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    @Autowired
    public RunSessionSocketHandler(RunSessionManager manager, ObjectMapper mapper) {
        this(manager, mapper, Executors.newCachedThreadPool(new CustomizableThreadFactory("ws-send-")));
    }

    RunSessionSocketHandler(RunSessionManager manager, ObjectMapper mapper, Executor sender) {
        this.manager = manager;
        this.mapper = mapper;
        this.messages = new ProtocolMessages(mapper);
        this.sender = sender;
    }

    @PreDestroy
    public void shutdown() {
        if (sender instanceof ExecutorService service) service.shutdownNow();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var socket = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        connections.put(session.getId(), new ClientConnection(socket, messages, sender));
        log.debug("[ws:{}] connected", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var connection = connections.get(session.getId());
        if (connection == null) return;

        JsonNode frame;
        try {
            frame = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            connection.send(messages.error(null, RunSessionException.Reason.INVALID_REQUEST.name(), "Malformed frame"));
            return;
        }
        var requestId = frame.hasNonNull("requestId") ? frame.get("requestId").asText() : null;
        var type = frame.path("type").asText();
        try {
            switch (type) {
                case "attach" -> attach(connection, frame, requestId);
                case "detach" -> detach(connection, frame, requestId);
                case "input" -> input(connection, frame, requestId);
                case "resize" -> resize(connection, frame, requestId);
                case "create" -> create(connection, frame, requestId);
                case "close" -> close(connection, frame, requestId);
                case "activity" -> activity(connection, frame);
                default -> connection.send(messages.error(requestId,
                        RunSessionException.Reason.INVALID_REQUEST.name(), "Unknown frame type: " + type));
            }
        } catch (RunSessionException e) {
            log.debug("[ws:{}] {} failed: {}", session.getId(), type, e.getMessage());
            connection.send(messages.error(requestId, e.reason().name(), e.getMessage()));
        } catch (IllegalArgumentException e) {
            connection.send(messages.error(requestId, RunSessionException.Reason.INVALID_REQUEST.name(), e.getMessage()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        var connection = connections.remove(session.getId());
        if (connection != null) {
            connection.detachAll();
            log.debug("[ws:{}] disconnected ({})", session.getId(), status.getCode());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("[ws:{}] transport error: {}", session.getId(), exception.getMessage());
    }

    int connectionCount() {
        return connections.size();
    }

    private void attach(ClientConnection connection, JsonNode frame, String requestId) {
        var sessionId = requireText(frame, "sessionId");
        long afterSeq = frame.path("afterSeq").asLong(0);
        var stream = connection.openStream(sessionId);
        AttachResult result;
        try {
            result = manager.attach(sessionId, afterSeq, stream);
        } catch (RunSessionException e) {
            connection.detach(sessionId);
            throw e;
        }
        stream.bind(result.subscription());
        var ack = messages.ack(requestId).put("sessionId", sessionId);
        ack.set("session", messages.session(result.session()));
        connection.send(ack);
        try {
            stream.replay(result.backlog(), result.activity());
        } catch (RunSessionException e) {
            connection.detach(sessionId);
            throw e;
        }
        if (!result.subscription().isActive()) connection.detach(sessionId);
    }

    private void detach(ClientConnection connection, JsonNode frame, String requestId) {
        var sessionId = requireText(frame, "sessionId");
        connection.detach(sessionId);
        connection.send(messages.ack(requestId).put("sessionId", sessionId));
    }

    private void input(ClientConnection connection, JsonNode frame, String requestId) {
        var sessionId = requireText(frame, "sessionId");
        var data = frame.path("data").asText("");
        manager.sendInput(sessionId, data.getBytes(StandardCharsets.UTF_8));
        if (requestId != null) connection.send(messages.ack(requestId).put("sessionId", sessionId));
    }

    private void resize(ClientConnection connection, JsonNode frame, String requestId) {
        var sessionId = requireText(frame, "sessionId");
        manager.resize(sessionId, frame.path("cols").asInt(0), frame.path("rows").asInt(0));
        if (requestId != null) connection.send(messages.ack(requestId).put("sessionId", sessionId));
    }

    private void create(ClientConnection connection, JsonNode frame, String requestId) {
        var kind = SessionKind.fromWire(requireText(frame, "kind"));
        var options = frame.path("options").isObject()
                ? mapper.convertValue(frame.get("options"), OPTIONS)
                : Map.<String, Object>of();
        var sessionId = frame.hasNonNull("sessionId") ? frame.get("sessionId").asText() : null;
        var id = manager.create(new CreateRequest(sessionId, kind, frame.path("workspacePath").asText(null), options));
        connection.send(messages.ack(requestId).put("sessionId", id));
    }

    private void close(ClientConnection connection, JsonNode frame, String requestId) {
        var sessionId = requireText(frame, "sessionId");
        manager.close(sessionId);
        connection.send(messages.ack(requestId).put("sessionId", sessionId));
    }

    private void activity(ClientConnection connection, JsonNode frame) {
        var sessionId = requireText(frame, "sessionId");
        connection.send(messages.status(sessionId, manager.getActivityState(sessionId)));
    }

    private static String requireText(JsonNode frame, String field) {
        var value = frame.path(field).asText("");
        if (value.isBlank()) throw new IllegalArgumentException(field + " is required");
        return value;
    }
}
