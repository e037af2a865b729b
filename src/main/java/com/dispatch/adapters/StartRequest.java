package com.dispatch.adapters;

import java.nio.file.Path;
import java.util.Map;

public record StartRequest(String sessionId, Path workspace, Map<String, Object> options) {

    public StartRequest {
        options = options != null ? options : Map.of();
    }

    public String stringOption(String name, String fallback) {
        var value = options.get(name);
        if (value == null || String.valueOf(value).isBlank()) return fallback;
        return String.valueOf(value);
    }

    public int intOption(String name, int fallback) {
        var value = options.get(name);
        if (value == null) return fallback;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + name + "' is not a number: " + value, e);
        }
    }
}
