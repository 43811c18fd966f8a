package com.example.calendarmcp.conflict;

import java.util.List;

public record ConflictResult(boolean hasConflicts, List<DuplicateMatch> duplicates, List<OverlapMatch> conflicts) {

    public static ConflictResult empty() {
        return new ConflictResult(false, List.of(), List.of());
    }

    public static ConflictResult of(List<DuplicateMatch> duplicates, List<OverlapMatch> conflicts) {
        return new ConflictResult(!duplicates.isEmpty() || !conflicts.isEmpty(),
                List.copyOf(duplicates), List.copyOf(conflicts));
    }
}
