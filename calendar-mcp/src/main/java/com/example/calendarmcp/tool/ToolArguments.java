package com.example.calendarmcp.tool;

import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Optional<String> string(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String text)) {
            throw invalid(name + " must be string");
        }
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public String requireString(String name) {
        return string(name).orElseThrow(() -> invalid(name + " is required"));
    }

    public String stringOrDefault(String name, String defaultValue) {
        return string(name).orElse(defaultValue);
    }

    public Optional<Boolean> bool(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Boolean flag)) {
            throw invalid(name + " must be boolean");
        }
        return Optional.of(flag);
    }

    public Optional<Double> number(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Number number)) {
            throw invalid(name + " must be number");
        }
        return Optional.of(number.doubleValue());
    }

    // A single string is accepted as a one-element list.
    public Optional<List<String>> stringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return text.isBlank() ? Optional.empty() : Optional.of(List.of(text));
        }
        if (!(value instanceof Collection<?> items)) {
            throw invalid(name + " must be string or array of strings");
        }
        List<String> strings = items.stream()
                .map(item -> {
                    if (!(item instanceof String text)) {
                        throw invalid(name + " must contain only strings");
                    }
                    return text;
                })
                .toList();
        return strings.isEmpty() ? Optional.empty() : Optional.of(strings);
    }

    public List<String> requireStringList(String name) {
        return stringList(name).orElseThrow(() -> invalid(name + " is required"));
    }

    private static McpException invalid(String message) {
        return new McpException(McpErrorCodes.INVALID_PARAMS, message);
    }
}
