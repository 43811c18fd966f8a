package com.example.calendarmcp.tool;

import com.example.calendarmcp.conflict.ConflictResult;
import com.example.calendarmcp.conflict.DuplicateMatch;
import com.example.calendarmcp.conflict.EventRef;
import com.example.calendarmcp.conflict.OverlapMatch;
import com.example.calendarmcp.model.Attendee;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.calendarmcp.TestEvents.allDay;
import static com.example.calendarmcp.TestEvents.timed;
import static org.assertj.core.api.Assertions.assertThat;

class EventFormatterTest {

    @Test
    void multiDayAllDayEventShowsInclusiveEndDate() {
        String text = EventFormatter.formatEvent(allDay("e1", "Offsite", "2024-03-01", "2024-03-04"), "primary");

        assertThat(text).contains("Start Date: Fri, Mar 1, 2024", "End Date: Sun, Mar 3, 2024");
    }

    @Test
    void singleAllDayEventShowsOneDate() {
        String text = EventFormatter.formatEvent(allDay("e1", "Holiday", "2024-12-25", "2024-12-26"), "primary");

        assertThat(text).contains("Date: Wed, Dec 25, 2024").doesNotContain("End Date");
    }

    @Test
    void timedEventIsRenderedInItsZone() {
        EventRecord event = timed("e1", "Standup", "2024-06-15T09:00:00", "2024-06-15T09:15:00", "Europe/Paris");

        String text = EventFormatter.formatEvent(event, "primary");

        assertThat(text).startsWith("Event: Standup\nEvent ID: e1");
        assertThat(text).contains("Start: Sat, Jun 15, 2024, 9:00 AM", "End: Sat, Jun 15, 2024, 9:15 AM");
    }

    @Test
    void includesGuestsAndGeneratedLink() {
        EventRecord event = timed("e1", null, "2024-06-15T09:00:00Z", "2024-06-15T09:15:00Z");
        event.setAttendees(List.of(
                new Attendee("ana@example.com", "Ana", "accepted", null, null, null),
                new Attendee("bo@example.com", null, "needsAction", null, null, null)));

        String text = EventFormatter.formatEvent(event, "team@example.com");

        assertThat(text).startsWith("Untitled Event");
        assertThat(text).contains("Guests: Ana (accepted), bo@example.com (pending)");
        assertThat(text).contains("View: https://calendar.google.com/calendar/event?eid=e1&cid=team%40example.com");
    }

    @Test
    void unparseableTimeIsShownVerbatim() {
        assertThat(EventFormatter.formatDateTime(TimeSpec.ofDateTime("soon"))).isEqualTo("soon");
        assertThat(EventFormatter.formatDateTime(null)).isEqualTo("unspecified");
    }

    @Test
    void responseHeadlineReflectsWarnings() {
        EventRecord event = timed("e1", "Standup", "2024-06-15T09:00:00Z", "2024-06-15T09:15:00Z");

        assertThat(EventFormatter.eventResponse(event, "primary", ConflictResult.empty(), "created"))
                .startsWith("Event created successfully!\n\nEvent: Standup");
        assertThat(EventFormatter.eventResponse(event, "primary", null, "updated"))
                .startsWith("Event updated successfully!");
    }

    @Test
    void formatsDuplicatesAndConflictsByCalendar() {
        EventRef existing = new EventRef("d1", "Standup", "https://example.com/d1", "2024-06-15T09:00:00Z", "2024-06-15T09:15:00Z");
        EventRef clash = new EventRef("c1", "Dentist", null, "2024-06-15T09:10:00Z", "2024-06-15T10:00:00Z");
        ConflictResult result = ConflictResult.of(
                List.of(new DuplicateMatch(existing, 0.95, "Consider updating.", "primary")),
                List.of(new OverlapMatch(clash, "work", "5 minutes", 33, "2024-06-15T09:10:00Z", "2024-06-15T09:15:00Z")));

        String text = EventFormatter.conflictWarnings(result);

        assertThat(text).contains(EventFormatter.DUPLICATES_HEADER, "Duplicate Event (95% similar)", "Consider updating.",
                "View existing event: https://example.com/d1");
        assertThat(text).contains(EventFormatter.CONFLICTS_HEADER, "Calendar: work", "Overlap: 5 minutes (33% of your event)",
                "Conflicts with \"Dentist\"", "Time: Sat, Jun 15, 2024, 9:10 AM UTC - Sat, Jun 15, 2024, 10:00 AM UTC");
        assertThat(EventFormatter.conflictWarnings(ConflictResult.empty())).isEmpty();
    }
}
