package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.conflict.ConflictDetectionOptions;
import com.example.calendarmcp.conflict.ConflictDetectionService;
import com.example.calendarmcp.conflict.ConflictResult;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.recurring.EventType;
import com.example.calendarmcp.recurring.ModificationScope;
import com.example.calendarmcp.recurring.RecurrenceRuleException;
import com.example.calendarmcp.recurring.RecurringEventEditor;
import com.example.calendarmcp.time.DatetimeNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.calendarmcp.tool.ToolSchemas.attendees;
import static com.example.calendarmcp.tool.ToolSchemas.bool;
import static com.example.calendarmcp.tool.ToolSchemas.dateTime;
import static com.example.calendarmcp.tool.ToolSchemas.freeform;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;
import static com.example.calendarmcp.tool.ToolSchemas.stringArray;

@Slf4j
@Component
public class UpdateEventTool implements McpTool {
    private final CalendarApiClient calendarApiClient;
    private final ConflictDetectionService conflictDetectionService;
    private final RecurringEventEditor recurringEventEditor;

    public UpdateEventTool(CalendarApiClient calendarApiClient,
                           ConflictDetectionService conflictDetectionService,
                           RecurringEventEditor recurringEventEditor) {
        this.calendarApiClient = calendarApiClient;
        this.conflictDetectionService = conflictDetectionService;
        this.recurringEventEditor = recurringEventEditor;
    }

    @Override
    public String getName() {
        return "update-event";
    }

    @Override
    public String getDescription() {
        return "Update an event, or one or more occurrences of a recurring event";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.ofEntries(
                Map.entry("calendarId", string("Calendar id, defaults to primary")),
                Map.entry("eventId", string("Id of the event or recurring series")),
                Map.entry("summary", string("New title")),
                Map.entry("description", string("New description")),
                Map.entry("location", string("New location")),
                Map.entry("start", dateTime("New start, e.g. 2024-06-15T14:30:00")),
                Map.entry("end", dateTime("New end, e.g. 2024-06-15T15:30:00")),
                Map.entry("timeZone", string("IANA zone for zone-naive times; defaults to the calendar's zone")),
                Map.entry("attendees", attendees()),
                Map.entry("recurrence", stringArray("Replacement RRULE/EXDATE/RDATE lines")),
                Map.entry("colorId", string("Color id")),
                Map.entry("reminders", freeform("Reminder settings")),
                Map.entry("modificationScope", Map.of("type", "string",
                        "enum", List.of("thisEventOnly", "all", "thisAndFollowing"),
                        "description", "Which occurrences of a recurring event to change, defaults to all")),
                Map.entry("originalStartTime", dateTime("Original start of the occurrence, for thisEventOnly")),
                Map.entry("futureStartDate", dateTime("First occurrence to change, for thisAndFollowing")),
                Map.entry("checkConflicts", bool("Check the new time for conflicts, defaults to true")),
                Map.entry("calendarsToCheck", stringArray("Calendars checked for conflicts, defaults to calendarId"))
        ), List.of("eventId"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String calendarId = args.stringOrDefault("calendarId", CreateEventTool.DEFAULT_CALENDAR);
        String eventId = args.requireString("eventId");
        ModificationScope scope = ModificationScope.fromValue(args.string("modificationScope").orElse(null));

        EventRecord existing = calendarApiClient.getEvent(calendarId, eventId);
        String defaultZone = calendarApiClient.getCalendarTimeZone(calendarId);

        ConflictResult conflicts = null;
        boolean timeChanged = args.has("start") || args.has("end");
        if (timeChanged && args.bool("checkConflicts").orElse(true)) {
            conflicts = checkConflicts(args, existing, calendarId, eventId, defaultZone);
        }

        if (scope != ModificationScope.ALL && recurringEventEditor.classify(existing) != EventType.RECURRING) {
            throw new RecurrenceRuleException("Scope other than \"all\" only applies to recurring events");
        }

        EventRecord updated = switch (scope) {
            case THIS_EVENT_ONLY -> updateSingleInstance(args, calendarId, eventId, defaultZone);
            case ALL -> calendarApiClient.patchEvent(calendarId, eventId,
                    recurringEventEditor.buildPatch(args.asMap(), defaultZone));
            case THIS_AND_FOLLOWING -> updateFutureInstances(args, calendarId, eventId, existing, defaultZone);
        };
        log.debug("Updated event {} in {} with scope {}", eventId, calendarId, scope.value());

        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("event", updated);
        structured.put("modificationScope", scope.value());
        if (conflicts != null) {
            structured.put("conflicts", conflicts);
        }
        return result(EventFormatter.eventResponse(updated, calendarId, conflicts, "updated"), structured);
    }

    private ConflictResult checkConflicts(ToolArguments args, EventRecord existing, String calendarId,
                                          String eventId, String defaultZone) {
        String zone = args.string("timeZone").orElse(defaultZone);
        EventRecord candidate = existing.copy();
        candidate.setId(eventId);
        args.string("summary").ifPresent(candidate::setSummary);
        args.string("description").ifPresent(candidate::setDescription);
        args.string("location").ifPresent(candidate::setLocation);
        args.string("start").ifPresent(start -> candidate.setStart(DatetimeNormalizer.buildTimeSpec(start, zone)));
        args.string("end").ifPresent(end -> candidate.setEnd(DatetimeNormalizer.buildTimeSpec(end, zone)));

        ConflictDetectionOptions options = new ConflictDetectionOptions(
                false, true, args.stringList("calendarsToCheck").orElse(null), null, false);
        return conflictDetectionService.checkConflicts(candidate, calendarId, options);
    }

    private EventRecord updateSingleInstance(ToolArguments args, String calendarId, String eventId, String defaultZone) {
        String originalStartTime = args.string("originalStartTime")
                .orElseThrow(() -> new RecurrenceRuleException("originalStartTime is required for single instance updates"));
        String instanceId = recurringEventEditor.instanceId(eventId, originalStartTime);
        return calendarApiClient.patchEvent(calendarId, instanceId, recurringEventEditor.buildPatch(args.asMap(), defaultZone));
    }

    private EventRecord updateFutureInstances(ToolArguments args, String calendarId, String eventId,
                                              EventRecord original, String defaultZone) {
        String futureStartDate = args.string("futureStartDate")
                .orElseThrow(() -> new RecurrenceRuleException("futureStartDate is required for future instance updates"));
        String zone = args.string("timeZone").orElse(defaultZone);

        EventRecord limit = new EventRecord();
        limit.setRecurrence(recurringEventEditor.rewriteWithUntil(
                original.getRecurrence(), recurringEventEditor.untilBoundary(futureStartDate)));
        calendarApiClient.patchEvent(calendarId, eventId, limit);

        EventRecord successor = recurringEventEditor.stripIdentityFields(original);
        mergePatch(successor, recurringEventEditor.buildPatch(args.asMap(), defaultZone));
        String newStart = args.string("start").orElse(futureStartDate);
        String newEnd = args.string("end").orElseGet(() -> recurringEventEditor.preservedDurationEnd(newStart, original, zone));
        successor.setStart(TimeSpec.ofDateTime(newStart, zone));
        successor.setEnd(TimeSpec.ofDateTime(newEnd, zone));
        log.info("Split series {} in {} at {}", eventId, calendarId, futureStartDate);
        return calendarApiClient.insertEvent(calendarId, successor);
    }

    private void mergePatch(EventRecord target, EventRecord patch) {
        if (patch.getSummary() != null) {
            target.setSummary(patch.getSummary());
        }
        if (patch.getDescription() != null) {
            target.setDescription(patch.getDescription());
        }
        if (patch.getLocation() != null) {
            target.setLocation(patch.getLocation());
        }
        if (patch.getAttendees() != null) {
            target.setAttendees(patch.getAttendees());
        }
        if (patch.getRecurrence() != null) {
            target.setRecurrence(patch.getRecurrence());
        }
        patch.getAdditionalProperties().forEach(target::setAdditionalProperty);
    }
}
