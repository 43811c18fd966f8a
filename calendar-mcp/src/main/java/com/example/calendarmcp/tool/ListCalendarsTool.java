package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;

@Component
public class ListCalendarsTool implements McpTool {
    private static final int DESCRIPTION_LIMIT = 100;
    private static final int FIELD_LIMIT = 500;

    private final CalendarApiClient calendarApiClient;

    public ListCalendarsTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "list-calendars";
    }

    @Override
    public String getDescription() {
        return "List all calendars available to the user";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(), List.of());
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        List<JsonNode> calendars = calendarApiClient.listCalendars();
        String text = calendars.stream().map(this::formatCalendar).collect(Collectors.joining("\n\n"));
        return result(text.isEmpty() ? "No calendars found." : text, Map.of(
                "calendars", calendars,
                "totalCount", calendars.size()
        ));
    }

    private String formatCalendar(JsonNode calendar) {
        String name = clean(firstText(calendar, "summaryOverride", "summary").orElse("Untitled"));
        StringBuilder text = new StringBuilder(name);
        if (calendar.path("primary").asBoolean(false)) {
            text.append(" (PRIMARY)");
        }
        text.append(" (").append(clean(textOr(calendar, "id", "no-id"))).append(')');
        text.append("\n  Timezone: ").append(clean(textOr(calendar, "timeZone", "Unknown")));
        text.append("\n  Kind: ").append(clean(textOr(calendar, "kind", "Unknown")));
        text.append("\n  Access Role: ").append(clean(textOr(calendar, "accessRole", "Unknown")));
        text.append("\n  Selected: ").append(calendar.path("selected").asBoolean(true) ? "Yes" : "No");
        text.append("\n  Hidden: ").append(calendar.path("hidden").asBoolean(false) ? "Yes" : "No");
        text.append("\n  Background Color: ").append(clean(textOr(calendar, "backgroundColor", "Default")));
        text.append("\n  Default Reminders: ").append(reminders(calendar.path("defaultReminders")));
        firstText(calendar, "description").map(ListCalendarsTool::clean).ifPresent(description -> {
            text.append("\n  Description: ");
            text.append(description.length() > DESCRIPTION_LIMIT
                    ? description.substring(0, DESCRIPTION_LIMIT) + "..."
                    : description);
        });
        return text.toString();
    }

    private String reminders(JsonNode reminders) {
        List<String> parts = new ArrayList<>();
        for (JsonNode reminder : reminders) {
            parts.add(clean(textOr(reminder, "method", "unknown")) + " (" + reminder.path("minutes").asInt(0) + "min before)");
        }
        return parts.isEmpty() ? "None" : String.join(", ", parts);
    }

    private static Optional<String> firstText(JsonNode node, String... names) {
        for (String name : names) {
            String value = node.path(name).asText("");
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static String textOr(JsonNode node, String name, String fallback) {
        return firstText(node, name).orElse(fallback);
    }

    // Control characters removed, capped at 500 characters.
    private static String clean(String value) {
        String cleaned = value.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F\\uFFFE\\uFFFF]", "");
        return (cleaned.length() > FIELD_LIMIT ? cleaned.substring(0, FIELD_LIMIT) : cleaned).trim();
    }
}
