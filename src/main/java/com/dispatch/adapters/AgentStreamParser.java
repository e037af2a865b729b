package com.dispatch.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps one line of the agent CLI's {@code stream-json} output to adapter events.
 * Lines that are not JSON objects pass through as plain stdout text.
 */
public class AgentStreamParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record ParsedLine(List<AdapterEvent> events, String conversationId, boolean turnEnded) {
        static ParsedLine of(List<AdapterEvent> events) {
            return new ParsedLine(events, null, false);
        }
    }

    public ParsedLine parse(String line) {
        var trimmed = line.strip();
        if (trimmed.isEmpty()) return ParsedLine.of(List.of());
        if (!trimmed.startsWith("{")) return ParsedLine.of(List.of(AdapterEvent.stdoutText(line)));

        JsonNode node;
        try {
            node = MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return ParsedLine.of(List.of(AdapterEvent.stdoutText(line)));
        }

        var type = node.path("type").asText();
        switch (type) {
            case "system": {
                String conversationId = "init".equals(node.path("subtype").asText())
                        ? textOrNull(node, "session_id") : null;
                return new ParsedLine(List.of(), conversationId, false);
            }
            case "assistant":
                return ParsedLine.of(assistantEvents(node.path("message").path("content")));
            case "user":
                return ParsedLine.of(toolResults(node.path("message").path("content")));
            case "result": {
                var payload = AdapterEvent.object()
                        .put("phase", "turn-end")
                        .put("isError", node.path("is_error").asBoolean(false));
                if (node.hasNonNull("result")) payload.put("result", node.get("result").asText());
                if (node.has("duration_ms")) payload.put("durationMs", node.get("duration_ms").asLong());
                if (node.has("total_cost_usd")) payload.put("costUsd", node.get("total_cost_usd").asDouble());
                return new ParsedLine(List.of(AdapterEvent.toolActivity(payload)),
                        textOrNull(node, "session_id"), true);
            }
            default:
                return ParsedLine.of(List.of());
        }
    }

    private List<AdapterEvent> assistantEvents(JsonNode content) {
        var events = new ArrayList<AdapterEvent>();
        if (content.isTextual()) {
            events.add(AdapterEvent.stdoutText(content.asText()));
            return events;
        }
        for (var block : content) {
            var blockType = block.path("type").asText();
            if ("text".equals(blockType)) {
                events.add(AdapterEvent.stdoutText(block.path("text").asText()));
            } else if ("tool_use".equals(blockType)) {
                var payload = AdapterEvent.object()
                        .put("phase", "tool-start")
                        .put("toolUseId", block.path("id").asText())
                        .put("name", block.path("name").asText());
                payload.set("input", block.path("input").deepCopy());
                events.add(AdapterEvent.toolActivity(payload));
            }
        }
        return events;
    }

    private List<AdapterEvent> toolResults(JsonNode content) {
        var events = new ArrayList<AdapterEvent>();
        for (var block : content) {
            if ("tool_result".equals(block.path("type").asText())) {
                events.add(AdapterEvent.toolActivity(AdapterEvent.object()
                        .put("phase", "tool-result")
                        .put("toolUseId", block.path("tool_use_id").asText())
                        .put("isError", block.path("is_error").asBoolean(false))));
            }
        }
        return events;
    }

    private static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
