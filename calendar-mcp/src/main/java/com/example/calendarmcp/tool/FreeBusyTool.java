package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import com.example.calendarmcp.time.DatetimeNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.dateTime;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;
import static com.example.calendarmcp.tool.ToolSchemas.stringArray;

@Component
public class FreeBusyTool implements McpTool {
    static final Duration MAX_RANGE = Duration.ofDays(90);

    private final CalendarApiClient calendarApiClient;

    public FreeBusyTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "get-freebusy";
    }

    @Override
    public String getDescription() {
        return "Query free/busy information for calendars over a range of at most three months";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "calendars", stringArray("Calendar ids or email addresses"),
                "timeMin", dateTime("Start of the range"),
                "timeMax", dateTime("End of the range"),
                "timeZone", string("IANA zone for zone-naive bounds and the response, defaults to UTC")
        ), List.of("calendars", "timeMin", "timeMax"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        List<String> calendars = args.requireStringList("calendars");
        String timeZone = args.string("timeZone").orElse(null);
        String timeMin = DatetimeNormalizer.toAbsoluteInstant(args.requireString("timeMin"), timeZone);
        String timeMax = DatetimeNormalizer.toAbsoluteInstant(args.requireString("timeMax"), timeZone);

        Instant min = parse(timeMin, "timeMin");
        Instant max = parse(timeMax, "timeMax");
        if (Duration.between(min, max).compareTo(MAX_RANGE) > 0) {
            return result("The time gap between timeMin and timeMax must be less than 3 months",
                    Map.of("error", "range_too_large"));
        }

        JsonNode response = calendarApiClient.queryFreeBusy(timeMin, timeMax, timeZone, calendars);
        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("timeMin", timeMin);
        structured.put("timeMax", timeMax);
        structured.put("calendars", response.path("calendars"));
        return result(summarize(response, timeMin, timeMax), structured);
    }

    private String summarize(JsonNode response, String timeMin, String timeMax) {
        List<String> lines = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> calendars = response.path("calendars").fields();
        while (calendars.hasNext()) {
            Map.Entry<String, JsonNode> calendar = calendars.next();
            String id = calendar.getKey();
            JsonNode info = calendar.getValue();
            if (hasError(info, "notFound")) {
                lines.add("Cannot check availability for " + id + " (account not found)");
                continue;
            }
            JsonNode busy = info.path("busy");
            if (busy.isEmpty()) {
                lines.add(id + " is available during " + timeMin + " to " + timeMax);
                continue;
            }
            StringBuilder text = new StringBuilder(id).append(" is busy during:");
            busy.forEach(slot -> text.append("\n- From ").append(slot.path("start").asText())
                    .append(" to ").append(slot.path("end").asText()));
            lines.add(text.toString());
        }
        return String.join("\n\n", lines);
    }

    private boolean hasError(JsonNode info, String reason) {
        for (JsonNode error : info.path("errors")) {
            if (reason.equals(error.path("reason").asText())) {
                return true;
            }
        }
        return false;
    }

    private Instant parse(String value, String name) {
        return DatetimeNormalizer.resolveInstant(TimeSpec.ofDateTime(value))
                .orElseThrow(() -> new McpException(McpErrorCodes.INVALID_PARAMS, name + " is not a valid date-time"));
    }
}
