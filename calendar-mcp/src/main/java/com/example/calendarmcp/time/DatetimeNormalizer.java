package com.example.calendarmcp.time;

import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public final class DatetimeNormalizer {
    private static final Pattern ZONED = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(Z|[+-]\\d{2}:\\d{2})$");
    private static final Pattern NAIVE = Pattern.compile(
            "^(\\d{4})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})$");

    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$");

    private DatetimeNormalizer() {
    }

    public static boolean hasExplicitZone(String datetime) {
        return datetime != null && ZONED.matcher(datetime).matches();
    }

    // Unparseable text or an unknown zone is read as UTC.
    public static String toAbsoluteInstant(String datetime, String fallbackZone) {
        if (hasExplicitZone(datetime)) {
            return datetime;
        }
        if (fallbackZone == null || fallbackZone.isBlank()) {
            return datetime + "Z";
        }
        try {
            Matcher matcher = NAIVE.matcher(datetime);
            if (!matcher.matches()) {
                throw new DateTimeException("Invalid datetime format: " + datetime);
            }
            LocalDateTime wanted = LocalDateTime.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(4)),
                    Integer.parseInt(matcher.group(5)),
                    Integer.parseInt(matcher.group(6)));
            return wallClockToInstant(wanted, ZoneId.of(fallbackZone)).toString();
        } catch (DateTimeException ex) {
            log.debug("Treating '{}' as UTC: {}", datetime, ex.getMessage());
            return datetime + "Z";
        }
    }

    // Render a UTC guess in the target zone and shift it by whatever the wall clock is off by.
    static Instant wallClockToInstant(LocalDateTime wanted, ZoneId zone) {
        Instant trial = wanted.toInstant(ZoneOffset.UTC);
        LocalDateTime rendered = LocalDateTime.ofInstant(trial, zone);
        Duration correction = Duration.between(rendered, wanted);
        return trial.plus(correction);
    }

    public static TimeSpec buildTimeSpec(String datetime, String fallbackZone) {
        if (datetime.indexOf('T') < 0) {
            return TimeSpec.ofDate(datetime);
        }
        if (hasExplicitZone(datetime)) {
            return TimeSpec.ofDateTime(datetime);
        }
        return TimeSpec.ofDateTime(datetime, fallbackZone);
    }

    public static Optional<Instant> resolveInstant(TimeSpec spec) {
        if (spec == null) {
            return Optional.empty();
        }
        try {
            if (spec.dateTime() != null) {
                return Optional.of(parseDateTime(spec.dateTime(), spec.timeZone()));
            }
            if (spec.date() != null) {
                return Optional.of(LocalDate.parse(spec.date()).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
        } catch (DateTimeException ex) {
            log.warn("Unparseable event time {}: {}", spec, ex.getMessage());
        }
        return Optional.empty();
    }

    public static Optional<TimeWindow> windowOf(EventRecord event) {
        if (event == null) {
            return Optional.empty();
        }
        Optional<Instant> start = resolveInstant(event.getStart());
        Optional<Instant> end = resolveInstant(event.getEnd());
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(start.get(), end.get()));
    }

    // Provider all-day end dates are exclusive.
    public static LocalDate displayEndDate(String exclusiveEndDate) {
        return LocalDate.parse(exclusiveEndDate).minusDays(1);
    }

    private static Instant parseDateTime(String text, String zone) {
        if (OFFSET_SUFFIX.matcher(text).find()) {
            return OffsetDateTime.parse(text).toInstant();
        }
        LocalDateTime local = LocalDateTime.parse(text);
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneOffset.UTC : ZoneId.of(zone);
        return wallClockToInstant(local, zoneId);
    }
}
