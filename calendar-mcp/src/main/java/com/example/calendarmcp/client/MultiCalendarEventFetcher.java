package com.example.calendarmcp.client;

import com.example.calendarmcp.batch.BatchRequest;
import com.example.calendarmcp.batch.BatchRequestExecutor;
import com.example.calendarmcp.batch.BatchResponse;
import com.example.calendarmcp.model.EventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Lists events from one or more calendars. A single calendar is read with a direct call whose
 * errors propagate; several calendars go out as one batch in which an inaccessible calendar only
 * adds a {@link CalendarError} entry.
 */
@Slf4j
@Component
public class MultiCalendarEventFetcher {
    private final CalendarApiClient calendarApiClient;
    private final BatchRequestExecutor batchRequestExecutor;

    public MultiCalendarEventFetcher(CalendarApiClient calendarApiClient, BatchRequestExecutor batchRequestExecutor) {
        this.calendarApiClient = calendarApiClient;
        this.batchRequestExecutor = batchRequestExecutor;
    }

    public CalendarFetchResult fetch(List<String> calendarIds, Function<String, EventListQuery> queryForCalendar) {
        if (calendarIds.size() == 1) {
            String calendarId = calendarIds.get(0);
            List<EventRecord> events = calendarApiClient.listEvents(calendarId, queryForCalendar.apply(calendarId));
            return new CalendarFetchResult(events, List.of());
        }

        List<BatchRequest> requests = calendarIds.stream()
                .map(calendarId -> BatchRequest.get(queryForCalendar.apply(calendarId).pathFor(calendarId)))
                .toList();
        List<BatchResponse> responses = batchRequestExecutor.execute(requests);

        List<EventRecord> events = new ArrayList<>();
        List<CalendarError> errors = new ArrayList<>();
        for (int i = 0; i < calendarIds.size(); i++) {
            String calendarId = calendarIds.get(i);
            if (i >= responses.size()) {
                errors.add(new CalendarError(calendarId, 0, "No response part returned"));
                continue;
            }
            BatchResponse response = responses.get(i);
            if (response.isSuccess()) {
                events.addAll(calendarApiClient.toEvents(response.body(), calendarId));
            } else {
                errors.add(new CalendarError(calendarId, response.statusCode(), response.errorMessage()));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Some calendars had errors: {}", errors);
        }
        events.sort(Comparator.comparing(MultiCalendarEventFetcher::startText));
        return new CalendarFetchResult(events, errors);
    }

    private static String startText(EventRecord event) {
        if (event.getStart() == null || event.getStart().value() == null) {
            return "";
        }
        return event.getStart().value();
    }
}
