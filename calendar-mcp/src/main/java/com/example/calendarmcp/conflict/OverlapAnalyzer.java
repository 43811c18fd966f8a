package com.example.calendarmcp.conflict;

import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.time.DatetimeNormalizer;
import com.example.calendarmcp.time.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class OverlapAnalyzer {

    public boolean overlaps(TimeWindow a, TimeWindow b) {
        return a.start().isBefore(b.end()) && b.start().isBefore(a.end());
    }

    public boolean overlaps(EventRecord a, EventRecord b) {
        Optional<TimeWindow> first = DatetimeNormalizer.windowOf(a);
        Optional<TimeWindow> second = DatetimeNormalizer.windowOf(b);
        return first.isPresent() && second.isPresent() && overlaps(first.get(), second.get());
    }

    public Duration overlapDuration(TimeWindow a, TimeWindow b) {
        Instant start = a.start().isAfter(b.start()) ? a.start() : b.start();
        Instant end = a.end().isBefore(b.end()) ? a.end() : b.end();
        Duration overlap = Duration.between(start, end);
        return overlap.isNegative() ? Duration.ZERO : overlap;
    }

    /**
     * Share of {@code a} covered by {@code b}, rounded to a whole percent. Not symmetric: the
     * question answered is how much of the first event is consumed.
     */
    public int overlapPercentage(TimeWindow a, TimeWindow b) {
        long total = a.duration().toMillis();
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(overlapDuration(a, b).toMillis() * 100.0 / total);
    }

    public String formatDuration(Duration duration) {
        return DurationFormatter.format(duration);
    }

    public Optional<OverlapReport> analyze(EventRecord candidate, EventRecord other) {
        Optional<TimeWindow> first = DatetimeNormalizer.windowOf(candidate);
        Optional<TimeWindow> second = DatetimeNormalizer.windowOf(other);
        if (first.isEmpty() || second.isEmpty() || !overlaps(first.get(), second.get())) {
            return Optional.empty();
        }
        TimeWindow a = first.get();
        TimeWindow b = second.get();
        Duration overlap = overlapDuration(a, b);
        TimeWindow window = new TimeWindow(
                a.start().isAfter(b.start()) ? a.start() : b.start(),
                a.end().isBefore(b.end()) ? a.end() : b.end());
        return Optional.of(new OverlapReport(overlap, formatDuration(overlap), overlapPercentage(a, b), window));
    }

    public List<EventRecord> findOverlapping(List<EventRecord> events, EventRecord candidate) {
        return events.stream()
                .filter(event -> candidate.getId() == null || !Objects.equals(event.getId(), candidate.getId()))
                .filter(event -> !event.isCancelled())
                .filter(event -> overlaps(candidate, event))
                .toList();
    }

    public boolean overlapsBusySlot(EventRecord event, String busyStart, String busyEnd) {
        if (busyStart == null || busyEnd == null) {
            return false;
        }
        Optional<TimeWindow> window = DatetimeNormalizer.windowOf(event);
        Optional<Instant> start = DatetimeNormalizer.resolveInstant(TimeSpec.ofDateTime(busyStart));
        Optional<Instant> end = DatetimeNormalizer.resolveInstant(TimeSpec.ofDateTime(busyEnd));
        if (window.isEmpty() || start.isEmpty() || end.isEmpty()) {
            return false;
        }
        return overlaps(window.get(), new TimeWindow(start.get(), end.get()));
    }
}
