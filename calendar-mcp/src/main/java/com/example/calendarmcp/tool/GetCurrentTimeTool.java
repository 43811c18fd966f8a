package com.example.calendarmcp.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;

@Component
public class GetCurrentTimeTool implements McpTool {
    static final String SYSTEM_ZONE_NOTE =
            "System timezone shown. For HTTP mode, specify timeZone parameter for user's local time.";

    private static final DateTimeFormatter UTC_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter RFC_3339 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
    private static final DateTimeFormatter HUMAN_READABLE =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' hh:mm:ss a zzzz", Locale.US);
    private static final DateTimeFormatter OFFSET = DateTimeFormatter.ofPattern("XXX");

    private final Clock clock;
    private final ObjectMapper objectMapper;

    public GetCurrentTimeTool(Clock clock, ObjectMapper objectMapper) {
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "get-current-time";
    }

    @Override
    public String getDescription() {
        return "Get the current date and time, optionally in a given time zone";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "timeZone", string("IANA zone, e.g. America/Los_Angeles; defaults to the server's zone")
        ), List.of());
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        Instant now = clock.instant();

        Map<String, Object> currentTime = new LinkedHashMap<>();
        currentTime.put("utc", UTC_MILLIS.format(now));
        currentTime.put("timestamp", now.toEpochMilli());
        args.string("timeZone").ifPresentOrElse(
                zone -> currentTime.put("requestedTimeZone", zoneDetails(now, parseZone(zone))),
                () -> {
                    currentTime.put("systemTimeZone", zoneDetails(now, clock.getZone()));
                    currentTime.put("note", SYSTEM_ZONE_NOTE);
                });

        Map<String, Object> structured = Map.of("currentTime", currentTime);
        return result(toJson(structured), structured);
    }

    private Map<String, Object> zoneDetails(Instant now, ZoneId zone) {
        ZonedDateTime local = now.truncatedTo(ChronoUnit.SECONDS).atZone(zone);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timeZone", zone.getId());
        details.put("rfc3339", RFC_3339.format(local));
        details.put("humanReadable", HUMAN_READABLE.format(local));
        details.put("offset", OFFSET.format(local));
        return details;
    }

    private ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + zone
                    + ". Use IANA timezone format like 'America/Los_Angeles' or 'UTC'.", ex);
        }
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not render current time", ex);
        }
    }
}
