package com.example.calendarmcp.conflict;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.CalendarApiException;
import com.example.calendarmcp.client.EventListQuery;
import com.example.calendarmcp.client.MultiCalendarEventFetcher;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.time.DatetimeNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
public class ConflictDetectionService {
    static final String BLOCKING_SUGGESTION =
            "This appears to be a duplicate. Consider updating the existing event instead.";
    static final String WARNING_SUGGESTION =
            "This event is very similar to an existing one. Is this intentional?";
    static final String BUSY_EVENT_ID = "busy-time";
    static final String BUSY_EVENT_TITLE = "Busy (details unavailable)";
    private static final int MAX_RESULTS = 250;

    private final MultiCalendarEventFetcher eventFetcher;
    private final CalendarApiClient calendarApiClient;
    private final EventSimilarityScorer similarityScorer;
    private final OverlapAnalyzer overlapAnalyzer;
    private final DuplicateThresholds thresholds;

    public ConflictDetectionService(MultiCalendarEventFetcher eventFetcher,
                                    CalendarApiClient calendarApiClient,
                                    EventSimilarityScorer similarityScorer,
                                    OverlapAnalyzer overlapAnalyzer,
                                    DuplicateThresholds thresholds) {
        this.eventFetcher = eventFetcher;
        this.calendarApiClient = calendarApiClient;
        this.similarityScorer = similarityScorer;
        this.overlapAnalyzer = overlapAnalyzer;
        this.thresholds = thresholds;
    }

    public DuplicateThresholds thresholds() {
        return thresholds;
    }

    public ConflictResult checkConflicts(EventRecord candidate, String calendarId, ConflictDetectionOptions options) {
        Optional<SearchWindow> window = searchWindow(candidate);
        if (window.isEmpty()) {
            return ConflictResult.empty();
        }
        String zone = zoneOf(candidate);
        EventListQuery query = EventListQuery.between(window.get().timeMin(), window.get().timeMax())
                .withTimeZone(zone)
                .withMaxResults(MAX_RESULTS);

        List<String> calendars = options.calendarsOrDefault(calendarId);
        List<EventRecord> existing;
        try {
            existing = eventFetcher.fetch(calendars, id -> query).events();
        } catch (CalendarApiException ex) {
            // status 0: provider unreachable, not a per-calendar failure
            if (ex.getStatusCode() == 0) {
                throw ex;
            }
            log.warn("Skipping conflict check for calendar {}: {}", calendars.get(0), ex.getMessage());
            existing = List.of();
        }

        List<DuplicateMatch> duplicates = options.checkDuplicates()
                ? findDuplicates(candidate, existing, options.thresholdOrDefault(thresholds))
                : List.of();
        List<OverlapMatch> conflicts = options.checkConflicts()
                ? findConflicts(candidate, existing, options.includeDeclinedEvents())
                : List.of();
        return ConflictResult.of(duplicates, conflicts);
    }

    public List<OverlapMatch> checkConflictsWithFreeBusy(EventRecord candidate, List<String> calendarIds) {
        Optional<SearchWindow> window = searchWindow(candidate);
        if (window.isEmpty()) {
            return List.of();
        }
        List<OverlapMatch> conflicts = new ArrayList<>();
        try {
            JsonNode response = calendarApiClient.queryFreeBusy(window.get().timeMin(), window.get().timeMax(), null, calendarIds);
            Iterator<Map.Entry<String, JsonNode>> calendars = response.path("calendars").fields();
            while (calendars.hasNext()) {
                Map.Entry<String, JsonNode> calendar = calendars.next();
                for (JsonNode slot : calendar.getValue().path("busy")) {
                    String start = slot.path("start").asText(null);
                    String end = slot.path("end").asText(null);
                    if (!overlapAnalyzer.overlapsBusySlot(candidate, start, end)) {
                        continue;
                    }
                    EventRecord busy = new EventRecord();
                    busy.setId(BUSY_EVENT_ID);
                    busy.setSummary(BUSY_EVENT_TITLE);
                    busy.setStart(TimeSpec.ofDateTime(start));
                    busy.setEnd(TimeSpec.ofDateTime(end));
                    overlapAnalyzer.analyze(candidate, busy)
                            .ifPresent(report -> conflicts.add(toOverlapMatch(busy, calendar.getKey(), report)));
                }
            }
        } catch (CalendarApiException ex) {
            log.warn("Failed to check free/busy: {}", ex.getMessage());
        }
        return conflicts;
    }

    private List<DuplicateMatch> findDuplicates(EventRecord candidate, List<EventRecord> existing, double threshold) {
        List<DuplicateMatch> duplicates = new ArrayList<>();
        for (EventRecord event : existing) {
            if (isSameEvent(candidate, event) || event.isCancelled()) {
                continue;
            }
            double similarity = similarityScorer.score(candidate, event);
            if (similarity < threshold) {
                continue;
            }
            String suggestion = thresholds.isBlocking(similarity) ? BLOCKING_SUGGESTION : WARNING_SUGGESTION;
            duplicates.add(new DuplicateMatch(
                    EventRef.of(event, event.getCalendarId()),
                    Math.round(similarity * 100) / 100.0,
                    suggestion,
                    event.getCalendarId()));
        }
        return duplicates;
    }

    private List<OverlapMatch> findConflicts(EventRecord candidate, List<EventRecord> existing,
                                             boolean includeDeclinedEvents) {
        List<OverlapMatch> conflicts = new ArrayList<>();
        for (EventRecord event : overlapAnalyzer.findOverlapping(existing, candidate)) {
            if (!includeDeclinedEvents && isDeclinedByRequester(event)) {
                continue;
            }
            overlapAnalyzer.analyze(candidate, event)
                    .ifPresent(report -> conflicts.add(toOverlapMatch(event, event.getCalendarId(), report)));
        }
        return conflicts;
    }

    // The requester's identity is not passed in, so their own response status cannot be looked up.
    // TODO: accept the requester's email in ConflictDetectionOptions and match it against attendees.
    boolean isDeclinedByRequester(EventRecord event) {
        return false;
    }

    private OverlapMatch toOverlapMatch(EventRecord event, String calendarId, OverlapReport report) {
        return new OverlapMatch(
                EventRef.of(event, calendarId),
                calendarId,
                report.durationText(),
                report.percentage(),
                report.window().start().toString(),
                report.window().end().toString());
    }

    private boolean isSameEvent(EventRecord candidate, EventRecord event) {
        return candidate.getId() != null && Objects.equals(candidate.getId(), event.getId());
    }

    private Optional<SearchWindow> searchWindow(EventRecord candidate) {
        if (candidate.getStart() == null || candidate.getEnd() == null) {
            return Optional.empty();
        }
        String timeMin = candidate.getStart().value();
        String timeMax = candidate.getEnd().value();
        if (timeMin == null || timeMax == null) {
            return Optional.empty();
        }
        String zone = zoneOf(candidate);
        return Optional.of(new SearchWindow(bound(timeMin, zone), bound(timeMax, zone)));
    }

    private String bound(String value, String zone) {
        if (value.indexOf('T') < 0) {
            return DatetimeNormalizer.toAbsoluteInstant(value + "T00:00:00", zone != null ? zone : "UTC");
        }
        if (zone != null && !DatetimeNormalizer.hasExplicitZone(value)) {
            return DatetimeNormalizer.toAbsoluteInstant(value, zone);
        }
        return value;
    }

    private String zoneOf(EventRecord candidate) {
        if (candidate.getStart().timeZone() != null) {
            return candidate.getStart().timeZone();
        }
        return candidate.getEnd() != null ? candidate.getEnd().timeZone() : null;
    }

    private record SearchWindow(String timeMin, String timeMax) {
    }
}
