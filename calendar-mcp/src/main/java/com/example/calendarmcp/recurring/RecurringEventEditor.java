package com.example.calendarmcp.recurring;

import com.example.calendarmcp.model.Attendee;
import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.time.DatetimeNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class RecurringEventEditor {
    static final String RRULE_PREFIX = "RRULE:";

    private static final DateTimeFormatter BASIC_UTC =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final Duration SPLIT_OFFSET = Duration.ofHours(24);
    private static final List<String> PASSTHROUGH_FIELDS = List.of(
            "colorId", "reminders", "conferenceData", "transparency", "visibility",
            "guestsCanInviteOthers", "guestsCanModify", "guestsCanSeeOtherGuests", "anyoneCanAddSelf",
            "extendedProperties", "attachments");

    private final ObjectMapper objectMapper;

    public RecurringEventEditor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EventType classify(EventRecord event) {
        return event.getRecurrence() != null && !event.getRecurrence().isEmpty()
                ? EventType.RECURRING
                : EventType.SINGLE;
    }

    public String instanceId(String seriesId, String originalStart) {
        return seriesId + "_" + basicUtc(parseInstant(originalStart, "original start time"));
    }

    public String untilBoundary(String futureStart) {
        return basicUtc(parseInstant(futureStart, "future start date").minus(SPLIT_OFFSET));
    }

    public List<String> rewriteWithUntil(List<String> ruleLines, String untilValue) {
        if (ruleLines == null || ruleLines.isEmpty()) {
            throw new RecurrenceRuleException("No recurrence rule found");
        }
        long repeatRules = ruleLines.stream().filter(line -> line.startsWith(RRULE_PREFIX)).count();
        if (repeatRules == 0) {
            throw new RecurrenceRuleException("No RRULE found in recurrence rules");
        }
        if (repeatRules > 1) {
            throw new RecurrenceRuleException("Expected exactly one RRULE line but found " + repeatRules);
        }

        List<String> rewritten = new ArrayList<>(ruleLines.size());
        for (String line : ruleLines) {
            rewritten.add(line.startsWith(RRULE_PREFIX) ? limitRule(line, untilValue) : line);
        }
        return rewritten;
    }

    public String preservedDurationEnd(String newStart, EventRecord original) {
        return preservedDurationEnd(newStart, original, original.getStart().timeZone());
    }

    // A naive newStart is read in zone, the zone the new start will be stamped with.
    public String preservedDurationEnd(String newStart, EventRecord original, String zone) {
        Instant originalStart = DatetimeNormalizer.resolveInstant(original.getStart())
                .orElseThrow(() -> new IllegalArgumentException("Original event has no usable start time"));
        Instant originalEnd = DatetimeNormalizer.resolveInstant(original.getEnd())
                .orElseThrow(() -> new IllegalArgumentException("Original event has no usable end time"));
        Instant start = DatetimeNormalizer.resolveInstant(TimeSpec.ofDateTime(newStart, zone))
                .orElseThrow(() -> new IllegalArgumentException("Invalid start time: " + newStart));
        return start.plus(Duration.between(originalStart, originalEnd)).toString();
    }

    public EventRecord stripIdentityFields(EventRecord event) {
        EventRecord copy = event.copy();
        copy.setId(null);
        copy.setEtag(null);
        copy.setIcalUid(null);
        copy.setCreated(null);
        copy.setUpdated(null);
        copy.setHtmlLink(null);
        copy.setHangoutLink(null);
        return copy;
    }

    /**
     * Builds a patch body holding only the arguments that were actually supplied. When start or end
     * changes, both receive the effective zone ({@code timeZone} argument, else {@code defaultZone});
     * with no time change a supplied zone alone still produces zone-only start and end.
     */
    public EventRecord buildPatch(Map<String, Object> args, String defaultZone) {
        EventRecord patch = new EventRecord();
        stringArg(args, "summary").ifPresent(patch::setSummary);
        stringArg(args, "description").ifPresent(patch::setDescription);
        stringArg(args, "location").ifPresent(patch::setLocation);
        if (args.get("attendees") != null) {
            patch.setAttendees(objectMapper.convertValue(args.get("attendees"), new TypeReference<List<Attendee>>() {
            }));
        }
        if (args.get("recurrence") != null) {
            patch.setRecurrence(objectMapper.convertValue(args.get("recurrence"), new TypeReference<List<String>>() {
            }));
        }
        for (String field : PASSTHROUGH_FIELDS) {
            if (args.get(field) != null) {
                patch.setAdditionalProperty(field, args.get(field));
            }
        }

        String zone = stringArg(args, "timeZone").filter(value -> !value.isBlank()).orElse(defaultZone);
        String start = stringArg(args, "start").orElse(null);
        String end = stringArg(args, "end").orElse(null);
        if (start != null) {
            patch.setStart(TimeSpec.ofDateTime(start, zone));
        }
        if (end != null) {
            patch.setEnd(TimeSpec.ofDateTime(end, zone));
        }
        boolean timeChanged = start != null || end != null;
        if (timeChanged || zone != null) {
            patch.setStart(withZone(patch.getStart(), zone));
            patch.setEnd(withZone(patch.getEnd(), zone));
        }
        return patch;
    }

    private TimeSpec withZone(TimeSpec spec, String zone) {
        if (spec == null) {
            return TimeSpec.ofZone(zone);
        }
        return spec.timeZone() == null ? spec.withTimeZone(zone) : spec;
    }

    private String limitRule(String rule, String untilValue) {
        String parameters = rule.substring(RRULE_PREFIX.length());
        String limited = Stream.concat(
                        Arrays.stream(parameters.split(";"))
                                .filter(part -> !part.isEmpty())
                                .filter(part -> !isLimiter(part)),
                        Stream.of("UNTIL=" + untilValue))
                .collect(Collectors.joining(";"));
        return RRULE_PREFIX + limited;
    }

    private boolean isLimiter(String parameter) {
        String upper = parameter.toUpperCase(Locale.ROOT);
        return upper.startsWith("UNTIL=") || upper.startsWith("COUNT=");
    }

    private Optional<String> stringArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    private Instant parseInstant(String text, String label) {
        if (text == null || text.isBlank()) {
            throw new RecurrenceRuleException("Missing " + label);
        }
        return DatetimeNormalizer.resolveInstant(TimeSpec.ofDateTime(text))
                .orElseThrow(() -> new RecurrenceRuleException("Invalid " + label + ": " + text));
    }

    private String basicUtc(Instant instant) {
        return BASIC_UTC.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
