package com.example.calendarmcp.conflict;

import com.example.calendarmcp.client.CalendarPaths;
import com.example.calendarmcp.model.EventRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventRef(String id, String title, String url, String start, String end) {
    private static final String UNTITLED = "Untitled Event";
    private static final String EVENT_VIEW_URL = "https://calendar.google.com/calendar/event?eid=%s&cid=%s";

    public static EventRef of(EventRecord event, String calendarId) {
        return new EventRef(
                event.getId(),
                event.getSummary() != null ? event.getSummary() : UNTITLED,
                eventUrl(event, calendarId),
                event.getStart() != null ? event.getStart().value() : null,
                event.getEnd() != null ? event.getEnd().value() : null);
    }

    public static String eventUrl(EventRecord event, String calendarId) {
        if (event.getHtmlLink() != null) {
            return event.getHtmlLink();
        }
        if (calendarId == null || event.getId() == null) {
            return null;
        }
        return String.format(EVENT_VIEW_URL, CalendarPaths.encode(event.getId()), CalendarPaths.encode(calendarId));
    }
}
