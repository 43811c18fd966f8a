package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.example.calendarmcp.client.CalendarApiException;
import com.example.calendarmcp.conflict.ConflictDetectionOptions;
import com.example.calendarmcp.conflict.ConflictDetectionService;
import com.example.calendarmcp.conflict.ConflictResult;
import com.example.calendarmcp.conflict.DuplicateMatch;
import com.example.calendarmcp.model.Attendee;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import com.example.calendarmcp.time.DatetimeNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.calendarmcp.tool.ToolSchemas.attendees;
import static com.example.calendarmcp.tool.ToolSchemas.bool;
import static com.example.calendarmcp.tool.ToolSchemas.dateTime;
import static com.example.calendarmcp.tool.ToolSchemas.freeform;
import static com.example.calendarmcp.tool.ToolSchemas.number;
import static com.example.calendarmcp.tool.ToolSchemas.object;
import static com.example.calendarmcp.tool.ToolSchemas.result;
import static com.example.calendarmcp.tool.ToolSchemas.string;
import static com.example.calendarmcp.tool.ToolSchemas.stringArray;

@Slf4j
@Component
public class CreateEventTool implements McpTool {
    static final String DEFAULT_CALENDAR = "primary";
    static final List<String> PASSTHROUGH_FIELDS = List.of(
            "colorId", "reminders", "transparency", "visibility", "guestsCanInviteOthers", "guestsCanModify",
            "guestsCanSeeOtherGuests", "anyoneCanAddSelf", "conferenceData", "extendedProperties", "attachments",
            "source");

    private final CalendarApiClient calendarApiClient;
    private final ConflictDetectionService conflictDetectionService;
    private final ObjectMapper objectMapper;

    public CreateEventTool(CalendarApiClient calendarApiClient,
                           ConflictDetectionService conflictDetectionService,
                           ObjectMapper objectMapper) {
        this.calendarApiClient = calendarApiClient;
        this.conflictDetectionService = conflictDetectionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "create-event";
    }

    @Override
    public String getDescription() {
        return "Create a calendar event, warning about overlaps and refusing likely duplicates";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return object(Map.ofEntries(
                Map.entry("calendarId", string("Calendar id, defaults to primary")),
                Map.entry("summary", string("Event title")),
                Map.entry("start", dateTime("Start, e.g. 2024-06-15T14:30:00, or a date for all-day events")),
                Map.entry("end", dateTime("End, e.g. 2024-06-15T15:30:00, or an exclusive end date")),
                Map.entry("timeZone", string("IANA zone for zone-naive times; defaults to the calendar's zone")),
                Map.entry("description", string("Event description")),
                Map.entry("location", string("Event location")),
                Map.entry("attendees", attendees()),
                Map.entry("recurrence", stringArray("RRULE/EXDATE/RDATE lines")),
                Map.entry("colorId", string("Color id")),
                Map.entry("reminders", freeform("Reminder settings")),
                Map.entry("transparency", string("opaque or transparent")),
                Map.entry("visibility", string("default, public, private or confidential")),
                Map.entry("eventId", string("Custom id: 5-1024 characters of a-v and 0-9")),
                Map.entry("calendarsToCheck", stringArray("Calendars checked for conflicts, defaults to calendarId")),
                Map.entry("duplicateSimilarityThreshold", number("Similarity from which an event counts as a duplicate")),
                Map.entry("allowDuplicates", bool("Create even when a duplicate exists"))
        ), List.of("summary", "start", "end"));
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String calendarId = args.stringOrDefault("calendarId", DEFAULT_CALENDAR);
        String summary = args.requireString("summary");
        String start = args.requireString("start");
        String end = args.requireString("end");
        Optional<String> eventId = args.string("eventId");
        eventId.ifPresent(EventIdValidator::validate);

        String zone = args.string("timeZone").orElseGet(() -> calendarApiClient.getCalendarTimeZone(calendarId));
        EventRecord event = new EventRecord();
        event.setSummary(summary);
        args.string("description").ifPresent(event::setDescription);
        args.string("location").ifPresent(event::setLocation);
        event.setStart(DatetimeNormalizer.buildTimeSpec(start, zone));
        event.setEnd(DatetimeNormalizer.buildTimeSpec(end, zone));
        if (args.has("attendees")) {
            event.setAttendees(objectMapper.convertValue(arguments.get("attendees"), new TypeReference<List<Attendee>>() {
            }));
        }
        args.stringList("recurrence").ifPresent(event::setRecurrence);

        ConflictDetectionOptions options = ConflictDetectionOptions.defaults()
                .withCalendarsToCheck(args.stringList("calendarsToCheck").orElse(null))
                .withDuplicateThreshold(args.number("duplicateSimilarityThreshold").orElse(null));
        ConflictResult conflicts = conflictDetectionService.checkConflicts(event, calendarId, options);

        Optional<DuplicateMatch> blocking = conflicts.duplicates().stream()
                .filter(duplicate -> conflictDetectionService.thresholds().isBlocking(duplicate.similarityScore()))
                .findFirst();
        if (blocking.isPresent() && !args.bool("allowDuplicates").orElse(false)) {
            log.info("Refusing to create '{}' in {}: duplicate of {}", summary, calendarId, blocking.get().event().id());
            return result(blockedMessage(blocking.get()), Map.of("created", false, "duplicate", blocking.get()));
        }

        for (String field : PASSTHROUGH_FIELDS) {
            if (arguments.get(field) != null) {
                event.setAdditionalProperty(field, arguments.get(field));
            }
        }
        eventId.ifPresent(event::setId);

        EventRecord created;
        try {
            created = calendarApiClient.insertEvent(calendarId, event);
        } catch (CalendarApiException ex) {
            if (eventId.isPresent() && ex.getStatusCode() == HttpStatus.CONFLICT.value()) {
                throw new McpException(McpErrorCodes.INVALID_PARAMS,
                        "Event ID '" + eventId.get() + "' already exists. Please use a different ID.");
            }
            throw ex;
        }

        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("created", true);
        structured.put("event", created);
        structured.put("conflicts", conflicts);
        return result(EventFormatter.eventResponse(created, calendarId, conflicts, "created"), structured);
    }

    private String blockedMessage(DuplicateMatch duplicate) {
        return "DUPLICATE EVENT DETECTED (" + EventFormatter.percent(duplicate.similarityScore()) + "% similar)!\n\n"
                + EventFormatter.duplicateDetails(duplicate).trim()
                + "\n\nThis event appears to be a duplicate. To create anyway, set allowDuplicates to true.";
    }
}
