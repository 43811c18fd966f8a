package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.conflict.ConflictDetectionOptions;
import com.example.calendarmcp.conflict.ConflictDetectionService;
import com.example.calendarmcp.conflict.ConflictResult;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.recurring.RecurrenceRuleException;
import com.example.calendarmcp.recurring.RecurringEventEditor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.TestEvents.timed;
import static com.example.calendarmcp.tool.CreateEventToolTest.structured;
import static com.example.calendarmcp.tool.CreateEventToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpdateEventToolTest {

    @Mock
    private CalendarApiClient calendarApiClient;

    @Mock
    private ConflictDetectionService conflictDetectionService;

    private UpdateEventTool tool;

    @BeforeEach
    void setUp() {
        tool = new UpdateEventTool(calendarApiClient, conflictDetectionService, new RecurringEventEditor(new ObjectMapper()));
    }

    @Test
    void updatesWholeEventByDefault() {
        givenEvent(timed("evt01", "Standup", "2024-06-15T09:00:00", "2024-06-15T09:15:00", "Europe/Paris"));
        when(calendarApiClient.patchEvent(eq("primary"), eq("evt01"), any()))
                .thenReturn(timed("evt01", "Daily standup", "2024-06-15T09:00:00", "2024-06-15T09:15:00", "Europe/Paris"));

        Map<String, Object> result = tool.invoke(Map.of("eventId", "evt01", "summary", "Daily standup"));

        ArgumentCaptor<EventRecord> patch = ArgumentCaptor.forClass(EventRecord.class);
        verify(calendarApiClient).patchEvent(eq("primary"), eq("evt01"), patch.capture());
        assertThat(patch.getValue().getSummary()).isEqualTo("Daily standup");
        assertThat(text(result)).startsWith("Event updated successfully!");
        assertThat(structured(result)).containsEntry("modificationScope", "all").doesNotContainKey("conflicts");
        verifyNoInteractions(conflictDetectionService);
    }

    @Test
    void checksNewTimeForOverlapsOnly() {
        givenEvent(timed("evt01", "Standup", "2024-06-15T09:00:00", "2024-06-15T09:15:00", "Europe/Paris"));
        when(conflictDetectionService.checkConflicts(any(), eq("primary"), any())).thenReturn(ConflictResult.empty());
        when(calendarApiClient.patchEvent(eq("primary"), eq("evt01"), any()))
                .thenReturn(timed("evt01", "Standup", "2024-06-15T10:00:00", "2024-06-15T10:15:00", "Europe/Paris"));

        Map<String, Object> result = tool.invoke(Map.of(
                "eventId", "evt01", "start", "2024-06-15T10:00:00", "end", "2024-06-15T10:15:00"));

        ArgumentCaptor<EventRecord> candidate = ArgumentCaptor.forClass(EventRecord.class);
        ArgumentCaptor<ConflictDetectionOptions> options = ArgumentCaptor.forClass(ConflictDetectionOptions.class);
        verify(conflictDetectionService).checkConflicts(candidate.capture(), eq("primary"), options.capture());
        assertThat(candidate.getValue().getId()).isEqualTo("evt01");
        assertThat(candidate.getValue().getSummary()).isEqualTo("Standup");
        assertThat(candidate.getValue().getStart()).isEqualTo(TimeSpec.ofDateTime("2024-06-15T10:00:00", "Europe/Paris"));
        assertThat(options.getValue().checkDuplicates()).isFalse();
        assertThat(options.getValue().checkConflicts()).isTrue();
        assertThat(structured(result)).containsKey("conflicts");
    }

    @Test
    void skipsConflictCheckWhenDisabled() {
        givenEvent(timed("evt01", "Standup", "2024-06-15T09:00:00", "2024-06-15T09:15:00", "Europe/Paris"));
        when(calendarApiClient.patchEvent(eq("primary"), eq("evt01"), any()))
                .thenReturn(timed("evt01", "Standup", "2024-06-15T10:00:00", "2024-06-15T10:15:00", "Europe/Paris"));

        tool.invoke(Map.of("eventId", "evt01", "start", "2024-06-15T10:00:00", "checkConflicts", false));

        verifyNoInteractions(conflictDetectionService);
    }

    @Test
    void rejectsInstanceScopeOnSingleEvent() {
        givenEvent(timed("evt01", "Standup", "2024-06-15T09:00:00Z", "2024-06-15T09:15:00Z"));

        assertThatThrownBy(() -> tool.invoke(Map.of(
                "eventId", "evt01",
                "modificationScope", "thisEventOnly",
                "originalStartTime", "2024-06-15T09:00:00Z")))
                .isInstanceOf(RecurrenceRuleException.class)
                .hasMessage("Scope other than \"all\" only applies to recurring events");
        verify(calendarApiClient, never()).patchEvent(any(), any(), any());
    }

    @Test
    void patchesSingleOccurrenceByInstanceId() {
        givenEvent(series());
        when(calendarApiClient.patchEvent(eq("primary"), eq("series01_20240615T070000Z"), any()))
                .thenReturn(timed("series01_20240615T070000Z", "Moved standup",
                        "2024-06-15T11:00:00", "2024-06-15T12:00:00", "Europe/Paris"));

        Map<String, Object> result = tool.invoke(Map.of(
                "eventId", "series01",
                "modificationScope", "thisEventOnly",
                "originalStartTime", "2024-06-15T09:00:00+02:00",
                "summary", "Moved standup",
                "checkConflicts", false));

        assertThat(structured(result)).containsEntry("modificationScope", "thisEventOnly");
        verify(calendarApiClient, never()).insertEvent(any(), any());
    }

    @Test
    void requiresOriginalStartForSingleOccurrence() {
        givenEvent(series());

        assertThatThrownBy(() -> tool.invoke(Map.of("eventId", "series01", "modificationScope", "thisEventOnly")))
                .isInstanceOf(RecurrenceRuleException.class)
                .hasMessage("originalStartTime is required for single instance updates");
    }

    @Test
    void splitsSeriesForFollowingOccurrences() {
        givenEvent(series());
        when(calendarApiClient.insertEvent(eq("primary"), any()))
                .thenReturn(timed("next01", "Weekly review", "2024-06-15T09:00:00", "2024-06-15T10:00:00", "Europe/Paris"));

        Map<String, Object> result = tool.invoke(Map.of(
                "eventId", "series01",
                "modificationScope", "thisAndFollowing",
                "futureStartDate", "2024-06-15T09:00:00+02:00",
                "summary", "Weekly review"));

        InOrder order = inOrder(calendarApiClient);
        ArgumentCaptor<EventRecord> limit = ArgumentCaptor.forClass(EventRecord.class);
        ArgumentCaptor<EventRecord> successor = ArgumentCaptor.forClass(EventRecord.class);
        order.verify(calendarApiClient).patchEvent(eq("primary"), eq("series01"), limit.capture());
        order.verify(calendarApiClient).insertEvent(eq("primary"), successor.capture());

        assertThat(limit.getValue().getRecurrence())
                .containsExactly("RRULE:FREQ=WEEKLY;BYDAY=SA;UNTIL=20240614T070000Z", "EXDATE:20240622T070000Z");
        assertThat(limit.getValue().getSummary()).isNull();

        EventRecord next = successor.getValue();
        assertThat(next.getId()).isNull();
        assertThat(next.getEtag()).isNull();
        assertThat(next.getSummary()).isEqualTo("Weekly review");
        assertThat(next.getLocation()).isEqualTo("Room 4");
        assertThat(next.getRecurrence()).containsExactly("RRULE:FREQ=WEEKLY;BYDAY=SA;COUNT=10", "EXDATE:20240622T070000Z");
        assertThat(next.getStart()).isEqualTo(TimeSpec.ofDateTime("2024-06-15T09:00:00+02:00", "Europe/Paris"));
        assertThat(next.getEnd()).isEqualTo(TimeSpec.ofDateTime("2024-06-15T08:00:00Z", "Europe/Paris"));
        assertThat(structured(result)).containsEntry("modificationScope", "thisAndFollowing");
    }

    @Test
    void splitSeriesKeepsDurationWhenZoneDiffersFromOriginal() {
        EventRecord original = timed("series02", "Sync", "2024-06-06T10:00:00", "2024-06-06T11:00:00", "America/New_York");
        original.setRecurrence(List.of("RRULE:FREQ=WEEKLY;BYDAY=TH"));
        givenEvent(original);
        when(calendarApiClient.insertEvent(eq("primary"), any()))
                .thenReturn(timed("next02", "Sync", "2024-06-20T10:00:00", "2024-06-20T11:00:00", "Europe/Berlin"));

        tool.invoke(Map.of(
                "eventId", "series02",
                "modificationScope", "thisAndFollowing",
                "futureStartDate", "2024-06-20T10:00:00",
                "timeZone", "Europe/Berlin"));

        ArgumentCaptor<EventRecord> successor = ArgumentCaptor.forClass(EventRecord.class);
        verify(calendarApiClient).insertEvent(eq("primary"), successor.capture());
        assertThat(successor.getValue().getStart()).isEqualTo(TimeSpec.ofDateTime("2024-06-20T10:00:00", "Europe/Berlin"));
        assertThat(successor.getValue().getEnd()).isEqualTo(TimeSpec.ofDateTime("2024-06-20T09:00:00Z", "Europe/Berlin"));
    }

    @Test
    void requiresFutureStartForFollowingOccurrences() {
        givenEvent(series());

        assertThatThrownBy(() -> tool.invoke(Map.of("eventId", "series01", "modificationScope", "thisAndFollowing")))
                .isInstanceOf(RecurrenceRuleException.class)
                .hasMessage("futureStartDate is required for future instance updates");
    }

    @Test
    void rejectsUnknownScope() {
        assertThatThrownBy(() -> tool.invoke(Map.of("eventId", "evt01", "modificationScope", "everything")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid modification scope: everything");
        verifyNoInteractions(calendarApiClient);
    }

    private void givenEvent(EventRecord event) {
        when(calendarApiClient.getEvent("primary", event.getId())).thenReturn(event);
        when(calendarApiClient.getCalendarTimeZone("primary")).thenReturn("Europe/Paris");
    }

    private static EventRecord series() {
        EventRecord event = timed("series01", "Standup", "2024-06-01T09:00:00", "2024-06-01T10:00:00", "Europe/Paris");
        event.setEtag("\"3181\"");
        event.setLocation("Room 4");
        event.setRecurrence(List.of("RRULE:FREQ=WEEKLY;BYDAY=SA;COUNT=10", "EXDATE:20240622T070000Z"));
        return event;
    }
}
