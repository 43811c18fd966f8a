package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;

@Component
public class ListColorsTool implements McpTool {
    private final CalendarApiClient calendarApiClient;

    public ListColorsTool(CalendarApiClient calendarApiClient) {
        this.calendarApiClient = calendarApiClient;
    }

    @Override
    public String getName() {
        return "list-colors";
    }

    @Override
    public String getDescription() {
        return "List the color ids available for events";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.of(), List.of());
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        JsonNode colors = calendarApiClient.getColors();
        JsonNode eventColors = colors != null ? colors.path("event") : null;

        StringBuilder text = new StringBuilder("Available event colors:\n");
        Map<String, Object> palette = new LinkedHashMap<>();
        if (eventColors != null) {
            Iterator<Map.Entry<String, JsonNode>> entries = eventColors.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String background = entry.getValue().path("background").asText();
                String foreground = entry.getValue().path("foreground").asText();
                text.append("Color ID: ").append(entry.getKey()).append(" - ")
                        .append(background).append(" (background) / ")
                        .append(foreground).append(" (foreground)\n");
                palette.put(entry.getKey(), Map.of("background", background, "foreground", foreground));
            }
        }
        return result(text.toString().trim(), Map.of("event", palette));
    }
}
