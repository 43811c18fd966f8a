package com.example.calendarmcp.batch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Result of one sub-request. {@code body} holds the parsed JSON; when the part body is not valid
 * JSON it is kept verbatim in {@code rawText} instead. A {@code statusCode} of 0 marks a part
 * that carried no status line.
 */
public record BatchResponse(int statusCode, Map<String, String> headers, JsonNode body, String rawText) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String errorMessage() {
        if (body != null) {
            JsonNode nested = body.path("error").path("message");
            if (nested.isTextual()) {
                return nested.asText();
            }
            JsonNode message = body.path("message");
            if (message.isTextual()) {
                return message.asText();
            }
        }
        return "HTTP " + statusCode;
    }
}
