package com.example.calendarmcp.recurring;

import java.util.Arrays;

public enum ModificationScope {
    THIS_EVENT_ONLY("thisEventOnly"),
    ALL("all"),
    THIS_AND_FOLLOWING("thisAndFollowing");

    private final String value;

    ModificationScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ModificationScope fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return Arrays.stream(values())
                .filter(scope -> scope.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid modification scope: " + value));
    }
}
