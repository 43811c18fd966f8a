package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.CalendarFetchResult;
import com.example.calendarmcp.client.EventFieldMask;
import com.example.calendarmcp.client.EventListQuery;
import com.example.calendarmcp.client.MultiCalendarEventFetcher;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.time.DatetimeNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.calendarmcp.tool.ToolSchemas.dateTime;
import static com.example.calendarmcp.tool.ToolSchemas.fields;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;
import static com.example.calendarmcp.tool.ToolSchemas.stringArray;
import static com.example.calendarmcp.tool.ToolSchemas.stringOrArray;

@Component
public class ListEventsTool implements McpTool {
    private final MultiCalendarEventFetcher eventFetcher;
    private final CalendarApiClient calendarApiClient;

    public ListEventsTool(MultiCalendarEventFetcher eventFetcher, CalendarApiClient calendarApiClient) {
        this.eventFetcher = eventFetcher;
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "list-events";
    }

    @Override
    public String getDescription() {
        return "List events from one or more calendars";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(
                "calendarId", stringOrArray("Calendar id, or an array of up to 50 ids to query in one batch"),
                "timeMin", dateTime("Start of the range, e.g. 2024-01-01T00:00:00"),
                "timeMax", dateTime("End of the range, e.g. 2024-01-31T23:59:59"),
                "timeZone", string("IANA zone for zone-naive bounds; defaults to each calendar's zone"),
                "fields", fields(),
                "privateExtendedProperty", stringArray("propertyName=value filters on private extended properties"),
                "sharedExtendedProperty", stringArray("propertyName=value filters on shared extended properties")
        ), List.of("calendarId"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        List<String> calendarIds = args.requireStringList("calendarId");
        String timeMin = args.string("timeMin").orElse(null);
        String timeMax = args.string("timeMax").orElse(null);
        String timeZone = args.string("timeZone").orElse(null);
        List<String> privateFilters = args.stringList("privateExtendedProperty").orElse(null);
        List<String> sharedFilters = args.stringList("sharedExtendedProperty").orElse(null);
        String fieldMask = EventFieldMask.forList(args.stringList("fields").orElse(null));

        CalendarFetchResult fetched = eventFetcher.fetch(calendarIds, calendarId -> {
            String zone = timeMin == null && timeMax == null ? null
                    : timeZone != null ? timeZone : calendarApiClient.getCalendarTimeZone(calendarId);
            return EventListQuery.between(
                            timeMin != null ? DatetimeNormalizer.toAbsoluteInstant(timeMin, zone) : null,
                            timeMax != null ? DatetimeNormalizer.toAbsoluteInstant(timeMax, zone) : null)
                    .withExtendedProperties(privateFilters, sharedFilters)
                    .withFields(fieldMask);
        });

        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("events", fetched.events());
        structured.put("totalCount", fetched.events().size());
        structured.put("calendars", calendarIds);
        if (!fetched.errors().isEmpty()) {
            structured.put("errors", fetched.errors());
        }
        return result(summarize(fetched.events(), calendarIds), structured);
    }

    private String summarize(List<EventRecord> events, List<String> calendarIds) {
        if (events.isEmpty()) {
            return "No events found in " + calendarIds.size() + " calendar(s).";
        }
        StringBuilder text = new StringBuilder("Found " + events.size() + " event(s)");
        if (calendarIds.size() == 1) {
            text.append(":\n\n");
            appendNumbered(text, events);
        } else {
            text.append(" across ").append(calendarIds.size()).append(" calendars:\n\n");
            Map<String, List<EventRecord>> byCalendar = events.stream()
                    .collect(Collectors.groupingBy(EventRecord::getCalendarId, LinkedHashMap::new, Collectors.toList()));
            byCalendar.forEach((calendarId, calendarEvents) -> {
                text.append("Calendar: ").append(calendarId).append("\n\n");
                appendNumbered(text, calendarEvents);
                text.append('\n');
            });
        }
        return text.toString().trim();
    }

    static void appendNumbered(StringBuilder text, List<EventRecord> events) {
        for (int i = 0; i < events.size(); i++) {
            EventRecord event = events.get(i);
            text.append(i + 1).append(". ").append(EventFormatter.formatEvent(event, event.getCalendarId())).append("\n\n");
        }
    }
}
