package com.example.calendarmcp.time;

import java.time.Duration;
import java.time.Instant;

// Half-open [start, end).
public record TimeWindow(Instant start, Instant end) {

    public Duration duration() {
        return Duration.between(start, end);
    }
}
