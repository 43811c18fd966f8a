package com.example.calendarmcp.client;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

public final class CalendarPaths {
    private static final String API_ROOT = "/calendar/v3";

    private CalendarPaths() {
    }

    public static String events(String calendarId) {
        return API_ROOT + "/calendars/" + encode(calendarId) + "/events";
    }

    public static String event(String calendarId, String eventId) {
        return events(calendarId) + "/" + encode(eventId);
    }

    public static String calendarList() {
        return API_ROOT + "/users/me/calendarList";
    }

    public static String calendarListEntry(String calendarId) {
        return calendarList() + "/" + encode(calendarId);
    }

    public static String colors() {
        return API_ROOT + "/colors";
    }

    public static String freeBusy() {
        return API_ROOT + "/freeBusy";
    }

    public static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }
}
