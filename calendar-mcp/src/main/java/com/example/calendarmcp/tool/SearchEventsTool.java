package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.EventFieldMask;
import com.example.calendarmcp.client.EventListQuery;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.time.DatetimeNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.dateTime;
import static com.example.calendarmcp.tool.ToolSchemas.fields;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;
import static com.example.calendarmcp.tool.ToolSchemas.stringArray;

@Component
public class SearchEventsTool implements McpTool {
    private final CalendarApiClient calendarApiClient;

    public SearchEventsTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "search-events";
    }

    @Override
    public String getDescription() {
        return "Search events by free text within a time range";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "calendarId", string("Calendar id, defaults to primary"),
                "query", string("Free text matched against title, description, location and attendees"),
                "timeMin", dateTime("Start of the range, e.g. 2024-01-01T00:00:00"),
                "timeMax", dateTime("End of the range, e.g. 2024-01-31T23:59:59"),
                "timeZone", string("IANA zone for zone-naive bounds; defaults to the calendar's zone"),
                "fields", fields(),
                "privateExtendedProperty", stringArray("propertyName=value filters on private extended properties"),
                "sharedExtendedProperty", stringArray("propertyName=value filters on shared extended properties")
        ), List.of("query", "timeMin", "timeMax"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String calendarId = args.stringOrDefault("calendarId", CreateEventTool.DEFAULT_CALENDAR);
        String text = args.requireString("query");
        String timeMin = args.requireString("timeMin");
        String timeMax = args.requireString("timeMax");
        String fieldMask = EventFieldMask.forList(args.stringList("fields").orElse(null));
        String zone = args.string("timeZone").orElseGet(() -> calendarApiClient.getCalendarTimeZone(calendarId));

        EventListQuery query = EventListQuery.between(
                        DatetimeNormalizer.toAbsoluteInstant(timeMin, zone),
                        DatetimeNormalizer.toAbsoluteInstant(timeMax, zone))
                .withQuery(text)
                .withExtendedProperties(
                        args.stringList("privateExtendedProperty").orElse(null),
                        args.stringList("sharedExtendedProperty").orElse(null))
                .withFields(fieldMask);
        List<EventRecord> events = calendarApiClient.listEvents(calendarId, query);

        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("events", events);
        structured.put("totalCount", events.size());
        structured.put("query", text);
        structured.put("calendarId", calendarId);
        return result(summarize(events), structured);
    }

    private String summarize(List<EventRecord> events) {
        if (events.isEmpty()) {
            return "No events found matching your search criteria.";
        }
        StringBuilder summary = new StringBuilder("Found " + events.size() + " event(s) matching your search:\n\n");
        ListEventsTool.appendNumbered(summary, events);
        return summary.toString().trim();
    }
}
