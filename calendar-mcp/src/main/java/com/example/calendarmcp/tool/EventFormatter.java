package com.example.calendarmcp.tool;

import com.example.calendarmcp.conflict.ConflictResult;
import com.example.calendarmcp.conflict.DuplicateMatch;
import com.example.calendarmcp.conflict.EventRef;
import com.example.calendarmcp.conflict.OverlapMatch;
import com.example.calendarmcp.model.Attendee;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.time.DatetimeNormalizer;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class EventFormatter {
    static final String DUPLICATES_HEADER = "POTENTIAL DUPLICATES DETECTED:";
    static final String CONFLICTS_HEADER = "SCHEDULING CONFLICTS DETECTED:";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEE, MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("EEE, MMM d, yyyy, h:mm a z", Locale.US);
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Map<String, String> RESPONSE_LABELS = Map.of(
            "accepted", "accepted",
            "declined", "declined",
            "tentative", "tentative",
            "needsAction", "pending");

    private EventFormatter() {
    }

    public static String formatEvent(EventRecord event, String calendarId) {
        StringBuilder text = new StringBuilder(event.getSummary() != null ? "Event: " + event.getSummary() : "Untitled Event");
        appendLine(text, "Event ID", event.getId());
        appendLine(text, "Description", event.getDescription());
        text.append(timeInfo(event));
        appendLine(text, "Location", event.getLocation());
        Object colorId = event.getAdditionalProperties().get("colorId");
        appendLine(text, "Color ID", colorId != null ? colorId.toString() : null);
        appendLine(text, "Guests", formatAttendees(event.getAttendees()));
        appendLine(text, "View", EventRef.eventUrl(event, calendarId));
        return text.toString();
    }

    public static String eventResponse(EventRecord event, String calendarId, ConflictResult conflicts, String verb) {
        boolean warn = conflicts != null && conflicts.hasConflicts();
        String headline = warn ? "Event " + verb + " with warnings!" : "Event " + verb + " successfully!";
        return headline + "\n\n" + formatEvent(event, calendarId) + (warn ? conflictWarnings(conflicts) : "");
    }

    public static String conflictWarnings(ConflictResult result) {
        if (result == null || !result.hasConflicts()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        if (!result.duplicates().isEmpty()) {
            text.append("\n\n").append(DUPLICATES_HEADER);
            result.duplicates().forEach(duplicate -> text.append(duplicateDetails(duplicate)));
        }
        if (!result.conflicts().isEmpty()) {
            text.append("\n\n").append(CONFLICTS_HEADER);
            Map<String, List<OverlapMatch>> byCalendar = result.conflicts().stream()
                    .collect(Collectors.groupingBy(
                            conflict -> String.valueOf(conflict.sourceCalendar()), LinkedHashMap::new, Collectors.toList()));
            byCalendar.forEach((calendar, conflicts) -> {
                text.append("\n\nCalendar: ").append(calendar);
                conflicts.forEach(conflict -> text.append(conflictDetails(conflict)));
            });
        }
        return text.toString();
    }

    static String duplicateDetails(DuplicateMatch duplicate) {
        StringBuilder text = new StringBuilder();
        text.append("\n\n--- Duplicate Event (").append(percent(duplicate.similarityScore())).append("% similar) ---");
        text.append('\n').append(duplicate.suggestion());
        text.append("\n• \"").append(duplicate.event().title()).append('"');
        if (duplicate.event().url() != null) {
            text.append("\n  View existing event: ").append(duplicate.event().url());
        }
        return text.toString();
    }

    public static long percent(double score) {
        return Math.round(score * 100);
    }

    public static String formatDateTime(TimeSpec spec) {
        if (spec == null || spec.value() == null) {
            return "unspecified";
        }
        if (spec.isAllDay()) {
            try {
                return DATE_FORMAT.format(LocalDate.parse(spec.date()));
            } catch (DateTimeException ex) {
                return spec.date();
            }
        }
        Optional<Instant> instant = DatetimeNormalizer.resolveInstant(spec);
        if (instant.isEmpty()) {
            return spec.dateTime();
        }
        return DATE_TIME_FORMAT.format(instant.get().atZone(displayZone(spec.timeZone())));
    }

    private static String conflictDetails(OverlapMatch conflict) {
        StringBuilder text = new StringBuilder("\n\n--- Conflicting Event ---");
        if (conflict.overlapDuration() != null) {
            text.append("\nOverlap: ").append(conflict.overlapDuration())
                    .append(" (").append(conflict.overlapPercentage()).append("% of your event)");
        }
        EventRef event = conflict.event();
        text.append("\n• Conflicts with \"").append(event.title()).append('"');
        if (event.start() != null && event.end() != null) {
            text.append("\n  Time: ").append(formatDateTime(specOf(event.start())))
                    .append(" - ").append(formatDateTime(specOf(event.end())));
        }
        if (event.url() != null) {
            text.append("\n  View event: ").append(event.url());
        }
        return text.toString();
    }

    private static String timeInfo(EventRecord event) {
        TimeSpec start = event.getStart();
        TimeSpec end = event.getEnd();
        if (start == null || !start.isAllDay()) {
            return "\nStart: " + formatDateTime(start) + "\nEnd: " + formatDateTime(end);
        }
        if (end == null || end.date() == null) {
            return "\nStart Date: " + formatDateTime(start);
        }
        LocalDate lastDay;
        try {
            lastDay = DatetimeNormalizer.displayEndDate(end.date());
        } catch (DateTimeException ex) {
            return "\nStart Date: " + formatDateTime(start) + "\nEnd Date: " + end.date();
        }
        if (end.date().equals(start.date()) || lastDay.toString().equals(start.date())) {
            return "\nDate: " + formatDateTime(start);
        }
        return "\nStart Date: " + formatDateTime(start) + "\nEnd Date: " + DATE_FORMAT.format(lastDay);
    }

    private static String formatAttendees(List<Attendee> attendees) {
        if (attendees == null || attendees.isEmpty()) {
            return null;
        }
        List<String> guests = new ArrayList<>();
        for (Attendee attendee : attendees) {
            String email = attendee.email() != null ? attendee.email() : "unknown";
            String name = attendee.displayName() != null ? attendee.displayName() : email;
            String status = RESPONSE_LABELS.getOrDefault(String.valueOf(attendee.responseStatus()), "unknown");
            guests.add(name + " (" + status + ")");
        }
        return String.join(", ", guests);
    }

    private static TimeSpec specOf(String value) {
        return value.indexOf('T') < 0 ? TimeSpec.ofDate(value) : TimeSpec.ofDateTime(value);
    }

    private static ZoneId displayZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return UTC;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException ex) {
            return UTC;
        }
    }

    private static void appendLine(StringBuilder text, String label, String value) {
        if (value != null && !value.isEmpty()) {
            text.append('\n').append(label).append(": ").append(value);
        }
    }
}
