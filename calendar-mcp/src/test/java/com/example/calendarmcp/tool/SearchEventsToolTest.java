package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.EventListQuery;
import com.example.calendarmcp.protocol.McpException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.TestEvents.onCalendar;
import static com.example.calendarmcp.TestEvents.timed;
import static com.example.calendarmcp.tool.CreateEventToolTest.structured;
import static com.example.calendarmcp.tool.CreateEventToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchEventsToolTest {

    @Mock
    private CalendarApiClient calendarApiClient;

    @InjectMocks
    private SearchEventsTool tool;

    @Test
    void searchesWithFreeTextInCalendarZone() {
        when(calendarApiClient.getCalendarTimeZone("primary")).thenReturn("Europe/Paris");
        when(calendarApiClient.listEvents(eq("primary"), any())).thenReturn(List.of(
                onCalendar(timed("e1", "Budget review", "2024-06-15T09:00:00Z", "2024-06-15T10:00:00Z"), "primary")));

        Map<String, Object> result = tool.invoke(Map.of(
                "query", "budget",
                "timeMin", "2024-06-01T00:00:00",
                "timeMax", "2024-06-30T23:59:59"));

        ArgumentCaptor<EventListQuery> query = ArgumentCaptor.forClass(EventListQuery.class);
        verify(calendarApiClient).listEvents(eq("primary"), query.capture());
        assertThat(query.getValue().query()).isEqualTo("budget");
        assertThat(query.getValue().timeMin()).isEqualTo("2024-05-31T22:00:00Z");
        assertThat(query.getValue().timeMax()).isEqualTo("2024-06-30T21:59:59Z");
        assertThat(query.getValue().pathFor("primary")).contains("&q=budget");
        assertThat(text(result)).startsWith("Found 1 event(s) matching your search:\n\n1. Event: Budget review");
        assertThat(structured(result)).containsEntry("totalCount", 1).containsEntry("query", "budget");
    }

    @Test
    void explicitZoneAndFiltersArePassedThrough() {
        when(calendarApiClient.listEvents(eq("work"), any())).thenReturn(List.of());

        Map<String, Object> result = tool.invoke(Map.of(
                "calendarId", "work",
                "query", "offsite",
                "timeMin", "2024-06-01T00:00:00Z",
                "timeMax", "2024-06-02T00:00:00",
                "timeZone", "UTC",
                "sharedExtendedProperty", List.of("team=platform"),
                "fields", List.of("description")));

        ArgumentCaptor<EventListQuery> query = ArgumentCaptor.forClass(EventListQuery.class);
        verify(calendarApiClient).listEvents(eq("work"), query.capture());
        assertThat(query.getValue().timeMax()).isEqualTo("2024-06-02T00:00:00Z");
        assertThat(query.getValue().sharedExtendedProperty()).containsExactly("team=platform");
        assertThat(query.getValue().fields()).contains("description");
        assertThat(text(result)).isEqualTo("No events found matching your search criteria.");
    }

    @Test
    void requiresQueryText() {
        assertThatThrownBy(() -> tool.invoke(Map.of("timeMin", "2024-06-01T00:00:00Z", "timeMax", "2024-06-02T00:00:00Z")))
                .isInstanceOf(McpException.class)
                .hasMessage("query is required");
        verifyNoInteractions(calendarApiClient);
    }
}
