package com.example.calendarmcp.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class EventIdValidator {
    static final int MIN_LENGTH = 5;
    static final int MAX_LENGTH = 1024;
    private static final Pattern BASE32HEX = Pattern.compile("^[a-v0-9]+$");

    private EventIdValidator() {
    }

    public static boolean isValid(String eventId) {
        return eventId != null
                && eventId.length() >= MIN_LENGTH
                && eventId.length() <= MAX_LENGTH
                && BASE32HEX.matcher(eventId).matches();
    }

    public static void validate(String eventId) {
        if (isValid(eventId)) {
            return;
        }
        String id = eventId != null ? eventId : "";
        List<String> problems = new ArrayList<>();
        if (id.length() < MIN_LENGTH) {
            problems.add("must be at least 5 characters long");
        }
        if (id.length() > MAX_LENGTH) {
            problems.add("must not exceed 1024 characters");
        }
        if (!BASE32HEX.matcher(id).matches()) {
            problems.add("can only contain lowercase letters a-v and digits 0-9 (base32hex encoding)");
        }
        throw new IllegalArgumentException("Invalid event ID: " + String.join(", ", problems));
    }
}
