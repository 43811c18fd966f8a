package com.example.calendarmcp.conflict;

public record OverlapMatch(
        EventRef event,
        String sourceCalendar,
        String overlapDuration,
        int overlapPercentage,
        String overlapStart,
        String overlapEnd
) {
}
