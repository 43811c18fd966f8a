package com.example.calendarmcp.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class BatchProtocolCodec {
    static final String CRLF = "\r\n";

    private static final Pattern HEADER_BOUNDARY = Pattern.compile("boundary=\"?([^\";\\s]+)\"?");
    private static final Pattern MARKER_BOUNDARY = Pattern.compile("--([a-zA-Z0-9_-]+)");
    private static final Pattern STATUS_LINE = Pattern.compile("^HTTP/\\d(?:\\.\\d)?\\s+(\\d{3})\\b.*");
    private static final int HEADER_SCAN_LINES = 10;

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public BatchProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String newBoundary() {
        return "batch_" + UUID.randomUUID().toString().replace("-", "");
    }

    public String encode(List<BatchRequest> requests, String boundary) {
        List<String> parts = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            BatchRequest request = requests.get(i);
            List<String> lines = new ArrayList<>();
            lines.add("--" + boundary);
            lines.add("Content-Type: application/http");
            lines.add("Content-ID: <item" + (i + 1) + ">");
            lines.add("");
            lines.add(request.method() + " " + request.path() + " HTTP/1.1");
            if (request.headers() != null) {
                request.headers().forEach((name, value) -> lines.add(name + ": " + value));
            }
            if (request.body() != null) {
                lines.add("Content-Type: application/json");
                lines.add("");
                lines.add(serialize(request.body()));
            }
            parts.add(String.join(CRLF, lines));
        }
        return String.join(CRLF + CRLF, parts) + CRLF + "--" + boundary + "--";
    }

    public List<BatchResponse> decode(String body, String contentType) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        String boundary = findBoundary(body, contentType);
        if (boundary == null) {
            log.warn("Batch response carries no multipart boundary; no parts decoded");
            return List.of();
        }

        String[] chunks = body.split(Pattern.quote("--" + boundary), -1);
        List<BatchResponse> responses = new ArrayList<>();
        for (int i = 1; i < chunks.length; i++) {
            String trimmed = chunks[i].trim();
            if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                continue;
            }
            responses.add(decodePart(chunks[i]));
        }
        return responses;
    }

    BatchResponse decodePart(String part) {
        List<String> lines = Arrays.asList(part.split("\r?\n", -1));

        int statusIndex = -1;
        int statusCode = 0;
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = STATUS_LINE.matcher(lines.get(i));
            if (matcher.matches()) {
                statusIndex = i;
                statusCode = Integer.parseInt(matcher.group(1));
                break;
            }
        }
        if (statusIndex < 0) {
            log.warn("Batch response part has no status line");
            return new BatchResponse(0, Map.of(), null, part.trim());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        int bodyStart = lines.size();
        for (int i = statusIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) {
                bodyStart = i + 1;
                break;
            }
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
        }

        int bodyEnd = lines.size();
        while (bodyEnd > bodyStart && lines.get(bodyEnd - 1).trim().isEmpty()) {
            bodyEnd--;
        }
        if (bodyStart >= bodyEnd) {
            return new BatchResponse(statusCode, headers, null, null);
        }
        String text = String.join("\n", lines.subList(bodyStart, bodyEnd));
        try {
            return new BatchResponse(statusCode, headers, strictReader.readTree(text), null);
        } catch (JsonProcessingException ex) {
            log.debug("Batch part body is not JSON, keeping raw text: {}", ex.getOriginalMessage());
            return new BatchResponse(statusCode, headers, null, text);
        }
    }

    private String findBoundary(String body, String contentType) {
        if (contentType != null) {
            Matcher matcher = HEADER_BOUNDARY.matcher(contentType);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        String[] lines = body.split("\r?\n", HEADER_SCAN_LINES + 1);
        for (int i = 0; i < Math.min(HEADER_SCAN_LINES, lines.length); i++) {
            String line = lines[i];
            if (line.toLowerCase(Locale.ROOT).contains("content-type:")) {
                Matcher matcher = HEADER_BOUNDARY.matcher(line);
                if (matcher.find()) {
                    return matcher.group(1);
                }
            }
        }
        Matcher marker = MARKER_BOUNDARY.matcher(body);
        return marker.find() ? marker.group(1) : null;
    }

    private String serialize(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Batch request body cannot be serialized to JSON", ex);
        }
    }
}
