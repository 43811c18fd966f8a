package com.example.calendarmcp.client;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class EventFieldMask {
    public static final List<String> ALLOWED_FIELDS = List.of(
            "id", "summary", "description", "start", "end", "location", "attendees", "colorId",
            "transparency", "extendedProperties", "reminders", "conferenceData", "attachments", "status",
            "htmlLink", "created", "updated", "creator", "organizer", "recurrence", "recurringEventId",
            "originalStartTime", "visibility", "iCalUID", "sequence", "hangoutLink", "anyoneCanAddSelf",
            "guestsCanInviteOthers", "guestsCanModify", "guestsCanSeeOtherGuests", "privateCopy", "locked",
            "source", "eventType");
    public static final List<String> DEFAULT_FIELDS = List.of(
            "id", "summary", "start", "end", "status", "htmlLink", "location", "attendees");

    private static final String LIST_ENVELOPE_FIELDS =
            "nextPageToken,nextSyncToken,kind,etag,summary,updated,timeZone,accessRole,defaultReminders";

    private EventFieldMask() {
    }

    public static String forEvent(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return null;
        }
        return String.join(",", withDefaults(requested));
    }

    public static String forList(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return null;
        }
        return "items(" + String.join(",", withDefaults(requested)) + ")," + LIST_ENVELOPE_FIELDS;
    }

    public static void validate(List<String> requested) {
        if (requested == null) {
            return;
        }
        List<String> invalid = requested.stream().filter(field -> !ALLOWED_FIELDS.contains(field)).toList();
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid fields requested: " + String.join(", ", invalid)
                    + ". Allowed fields: " + String.join(", ", ALLOWED_FIELDS));
        }
    }

    private static List<String> withDefaults(List<String> requested) {
        validate(requested);
        Set<String> fields = new LinkedHashSet<>(DEFAULT_FIELDS);
        fields.addAll(requested);
        return new ArrayList<>(fields);
    }
}
