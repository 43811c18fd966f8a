package com.example.calendarmcp.conflict;

public record DuplicateMatch(EventRef event, double similarityScore, String suggestion, String sourceCalendar) {
}
