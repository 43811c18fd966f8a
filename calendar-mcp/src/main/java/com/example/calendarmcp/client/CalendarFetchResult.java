package com.example.calendarmcp.client;

import com.example.calendarmcp.model.EventRecord;

import java.util.List;

public record CalendarFetchResult(List<EventRecord> events, List<CalendarError> errors) {
}
