package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;

@Component
public class DeleteEventTool implements McpTool {
    private final CalendarApiClient calendarApiClient;

    public DeleteEventTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "delete-event";
    }

    @Override
    public String getDescription() {
        return "Delete a calendar event";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "calendarId", string("Calendar id, defaults to primary"),
                "eventId", string("Id of the event to delete")
        ), List.of("eventId"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String calendarId = args.stringOrDefault("calendarId", CreateEventTool.DEFAULT_CALENDAR);
        String eventId = args.requireString("eventId");
        calendarApiClient.deleteEvent(calendarId, eventId);
        return result("Event deleted successfully", Map.of(
                "deleted", true,
                "calendarId", calendarId,
                "eventId", eventId
        ));
    }
}
