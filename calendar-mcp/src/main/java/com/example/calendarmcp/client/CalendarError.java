package com.example.calendarmcp.client;

public record CalendarError(String calendarId, int statusCode, String message) {
}
