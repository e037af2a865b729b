package com.dispatch.gateway.http;

import com.dispatch.gateway.ws.ProtocolMessages;
import com.dispatch.observability.DoctorCommand;
import com.dispatch.sessions.RunSessionException;
import com.dispatch.sessions.RunSessionManager;
import com.dispatch.sessions.RuntimeStats;
import com.dispatch.shared.model.SessionKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only views over run sessions. Everything that changes a session goes through the socket.
 */
@RestController
@RequestMapping("/api")
public class RunSessionController {

    private final RunSessionManager manager;
    private final DoctorCommand doctor;
    private final ObjectMapper mapper;
    private final ProtocolMessages messages;

    public RunSessionController(RunSessionManager manager, DoctorCommand doctor, ObjectMapper mapper) {
        this.manager = manager;
        this.doctor = doctor;
        this.mapper = mapper;
        this.messages = new ProtocolMessages(mapper);
    }

    @GetMapping("/runs")
    public ArrayNode list(@RequestParam(required = false) String kind) {
        var filter = kind != null && !kind.isBlank() ? SessionKind.fromWire(kind) : null;
        var result = mapper.createArrayNode();
        for (var summary : manager.list(filter)) {
            result.add(messages.session(summary.session()).put("live", summary.live()));
        }
        return result;
    }

    @GetMapping("/runs/{id}")
    public ObjectNode get(@PathVariable String id) {
        var run = messages.session(manager.get(id))
                .put("live", manager.isLive(id))
                .put("activityState", manager.getActivityState(id).wireName());
        var info = manager.describeWorkspace(id);
        var workspace = run.putObject("workspace")
                .put("path", info.path())
                .put("name", info.name())
                .put("exists", info.exists());
        if (info.lastModified() != null) workspace.put("lastModified", info.lastModified().toEpochMilli());
        return run;
    }

    @GetMapping("/runs/{id}/events")
    public ArrayNode events(@PathVariable String id, @RequestParam(defaultValue = "0") long after) {
        var result = mapper.createArrayNode();
        for (var event : manager.history(id, after)) {
            result.add(messages.eventBody(event));
        }
        return result;
    }

    @GetMapping("/runs/{id}/activity")
    public Map<String, String> activity(@PathVariable String id) {
        return Map.of("sessionId", id, "activityState", manager.getActivityState(id).wireName());
    }

    @GetMapping("/stats")
    public RuntimeStats stats() {
        return manager.stats();
    }

    @GetMapping(value = "/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }

    @ExceptionHandler(RunSessionException.class)
    public ResponseEntity<Map<String, String>> onRunSessionError(RunSessionException e) {
        var status = switch (e.reason()) {
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_NOT_RUNNING -> HttpStatus.CONFLICT;
            case INVALID_REQUEST, UNSUPPORTED_OPERATION -> HttpStatus.BAD_REQUEST;
            case SPAWN_FAILURE, PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(Map.of("code", e.reason().name(), "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("code", RunSessionException.Reason.INVALID_REQUEST.name(), "message", e.getMessage()));
    }
}
