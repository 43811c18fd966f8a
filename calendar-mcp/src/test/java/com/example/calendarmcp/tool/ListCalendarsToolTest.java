package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.CreateEventToolTest.structured;
import static com.example.calendarmcp.tool.CreateEventToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListCalendarsToolTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private CalendarApiClient calendarApiClient;

    @InjectMocks
    private ListCalendarsTool tool;

    @Test
    void describesEachCalendar() throws Exception {
        JsonNode primary = objectMapper.readTree("""
                {"id": "me@example.com", "summary": "Me", "summaryOverride": "Personal", "primary": true,
                 "timeZone": "Europe/Paris", "kind": "calendar#calendarListEntry", "accessRole": "owner",
                 "backgroundColor": "#9fe1e7",
                 "defaultReminders": [{"method": "popup", "minutes": 10}, {"method": "email", "minutes": 60}]}""");
        JsonNode shared = objectMapper.readTree("""
                {"id": "team@example.com", "accessRole": "reader", "selected": false, "hidden": true,
                 "description": "%s"}""".formatted("x".repeat(120)));
        when(calendarApiClient.listCalendars()).thenReturn(List.of(primary, shared));

        Map<String, Object> result = tool.invoke(Map.of());

        assertThat(text(result)).isEqualTo("""
                Personal (PRIMARY) (me@example.com)
                  Timezone: Europe/Paris
                  Kind: calendar#calendarListEntry
                  Access Role: owner
                  Selected: Yes
                  Hidden: No
                  Background Color: #9fe1e7
                  Default Reminders: popup (10min before), email (60min before)

                Untitled (team@example.com)
                  Timezone: Unknown
                  Kind: Unknown
                  Access Role: reader
                  Selected: No
                  Hidden: Yes
                  Background Color: Default
                  Default Reminders: None
                  Description: %s...""".formatted("x".repeat(100)));
        assertThat(structured(result)).containsEntry("totalCount", 2);
    }

    @Test
    void reportsEmptyCalendarList() {
        when(calendarApiClient.listCalendars()).thenReturn(List.of());

        assertThat(text(tool.invoke(Map.of()))).isEqualTo("No calendars found.");
    }
}
