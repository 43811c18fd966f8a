package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.EventFieldMask;

import java.util.List;
import java.util.Map;

final class ToolSchemas {
    private ToolSchemas() {
    }

    static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", required
        );
    }

    static Map<String, Object> string(String description) {
        return Map.of("type", "string", "description", description);
    }

    static Map<String, Object> dateTime(String description) {
        return Map.of("type", "string", "format", "date-time", "description", description);
    }

    static Map<String, Object> stringArray(String description) {
        return Map.of("type", "array", "items", Map.of("type", "string"), "description", description);
    }

    static Map<String, Object> stringOrArray(String description) {
        return Map.of(
                "anyOf", List.of(Map.of("type", "string"), Map.of("type", "array", "items", Map.of("type", "string"))),
                "description", description
        );
    }

    static Map<String, Object> fields() {
        return Map.of(
                "type", "array",
                "items", Map.of("type", "string", "enum", EventFieldMask.ALLOWED_FIELDS),
                "description", "Extra event fields to return beyond the defaults ("
                        + String.join(", ", EventFieldMask.DEFAULT_FIELDS) + ")"
        );
    }

    static Map<String, Object> bool(String description) {
        return Map.of("type", "boolean", "description", description);
    }

    static Map<String, Object> number(String description) {
        return Map.of("type", "number", "minimum", 0, "maximum", 1, "description", description);
    }

    static Map<String, Object> freeform(String description) {
        return Map.of("type", "object", "description", description);
    }

    static Map<String, Object> attendees() {
        return Map.of(
                "type", "array",
                "description", "Event attendees",
                "items", Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "email", Map.of("type", "string"),
                                "displayName", Map.of("type", "string"),
                                "optional", Map.of("type", "boolean")
                        ),
                        "required", List.of("email")
                )
        );
    }

    static Map<String, Object> result(String text, Map<String, Object> structuredContent) {
        return Map.of(
                "content", List.of(Map.of("type", "text", "text", text)),
                "structuredContent", structuredContent
        );
    }
}
