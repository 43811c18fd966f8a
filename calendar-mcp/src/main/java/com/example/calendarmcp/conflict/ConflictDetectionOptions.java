package com.example.calendarmcp.conflict;

import java.util.List;

public record ConflictDetectionOptions(
        boolean checkDuplicates,
        boolean checkConflicts,
        List<String> calendarsToCheck,
        Double duplicateThreshold,
        boolean includeDeclinedEvents
) {

    public static ConflictDetectionOptions defaults() {
        return new ConflictDetectionOptions(true, true, null, null, false);
    }

    public ConflictDetectionOptions withCalendarsToCheck(List<String> calendars) {
        return new ConflictDetectionOptions(checkDuplicates, checkConflicts, calendars, duplicateThreshold,
                includeDeclinedEvents);
    }

    public ConflictDetectionOptions withDuplicateThreshold(Double threshold) {
        return new ConflictDetectionOptions(checkDuplicates, checkConflicts, calendarsToCheck, threshold,
                includeDeclinedEvents);
    }

    List<String> calendarsOrDefault(String calendarId) {
        return calendarsToCheck == null || calendarsToCheck.isEmpty() ? List.of(calendarId) : calendarsToCheck;
    }

    double thresholdOrDefault(DuplicateThresholds thresholds) {
        return duplicateThreshold != null ? duplicateThreshold : thresholds.warning();
    }
}
