package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.CreateEventToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FreeBusyToolTest {

    @Mock
    private CalendarApiClient calendarApiClient;

    private FreeBusyTool tool;

    @BeforeEach
    void setUp() {
        tool = new FreeBusyTool(calendarApiClient);
    }

    @Test
    void summarizesBusySlotsPerCalendar() throws Exception {
        when(calendarApiClient.queryFreeBusy("2024-06-15T07:00:00Z", "2024-06-15T16:00:00Z", "Europe/Paris",
                List.of("primary", "room@example.com", "nobody@example.com")))
                .thenReturn(new ObjectMapper().readTree("""
                        {"calendars": {
                          "primary": {"busy": [
                            {"start": "2024-06-15T08:00:00Z", "end": "2024-06-15T09:00:00Z"},
                            {"start": "2024-06-15T13:00:00Z", "end": "2024-06-15T13:30:00Z"}]},
                          "room@example.com": {"busy": []},
                          "nobody@example.com": {"errors": [{"domain": "global", "reason": "notFound"}]}
                        }}"""));

        Map<String, Object> result = tool.invoke(Map.of(
                "calendars", List.of("primary", "room@example.com", "nobody@example.com"),
                "timeMin", "2024-06-15T09:00:00",
                "timeMax", "2024-06-15T18:00:00",
                "timeZone", "Europe/Paris"));

        assertThat(text(result)).isEqualTo("""
                primary is busy during:
                - From 2024-06-15T08:00:00Z to 2024-06-15T09:00:00Z
                - From 2024-06-15T13:00:00Z to 2024-06-15T13:30:00Z

                room@example.com is available during 2024-06-15T07:00:00Z to 2024-06-15T16:00:00Z

                Cannot check availability for nobody@example.com (account not found)""");
    }

    @Test
    void refusesRangesOverThreeMonths() {
        Map<String, Object> result = tool.invoke(Map.of(
                "calendars", "primary",
                "timeMin", "2024-01-01T00:00:00Z",
                "timeMax", "2024-04-15T00:00:00Z"));

        assertThat(text(result)).isEqualTo("The time gap between timeMin and timeMax must be less than 3 months");
        verifyNoInteractions(calendarApiClient);
    }

    @Test
    void rejectsUnparseableBounds() {
        assertThatThrownBy(() -> tool.invoke(Map.of(
                "calendars", "primary",
                "timeMin", "tomorrow",
                "timeMax", "2024-04-15T00:00:00Z")))
                .isInstanceOfSatisfying(McpException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(McpErrorCodes.INVALID_PARAMS))
                .hasMessage("timeMin is not a valid date-time");
    }
}
