package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.CalendarApiException;
import com.example.calendarmcp.client.EventFieldMask;
import com.example.calendarmcp.model.EventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.fields;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;

@Slf4j
@Component
public class GetEventTool implements McpTool {
    private static final int NOT_FOUND = 404;

    private final CalendarApiClient calendarApiClient;

    public GetEventTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "get-event";
    }

    @Override
    public String getDescription() {
        return "Get one event by id";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "calendarId", string("Calendar id, defaults to primary"),
                "eventId", string("Id of the event"),
                "fields", fields()
        ), List.of("eventId"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String calendarId = args.stringOrDefault("calendarId", CreateEventTool.DEFAULT_CALENDAR);
        String eventId = args.requireString("eventId");
        String fieldMask = EventFieldMask.forEvent(args.stringList("fields").orElse(null));

        EventRecord event;
        try {
            event = calendarApiClient.getEvent(calendarId, eventId, fieldMask);
        } catch (CalendarApiException ex) {
            if (ex.getStatusCode() != NOT_FOUND) {
                throw ex;
            }
            log.debug("Event {} not found in {}", eventId, calendarId);
            event = null;
        }

        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("calendarId", calendarId);
        structured.put("eventId", eventId);
        structured.put("found", event != null);
        if (event == null) {
            return result("Event with ID '" + eventId + "' not found in calendar '" + calendarId + "'.", structured);
        }
        structured.put("event", event);
        return result("Event Details:\n\n" + EventFormatter.formatEvent(event, calendarId), structured);
    }
}
