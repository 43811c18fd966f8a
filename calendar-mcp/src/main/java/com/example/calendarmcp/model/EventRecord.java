package com.example.calendarmcp.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Fields not interpreted here round-trip through additionalProperties.
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventRecord {
    public static final String STATUS_CANCELLED = "cancelled";

    private String id;
    private String etag;
    @JsonProperty("iCalUID")
    private String icalUid;
    private String created;
    private String updated;
    private String htmlLink;
    private String hangoutLink;
    private String status;
    private String summary;
    private String description;
    private String location;
    private TimeSpec start;
    private TimeSpec end;
    private List<Attendee> attendees;
    private List<String> recurrence;
    private String recurringEventId;

    @JsonIgnore
    private String calendarId;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        additionalProperties.put(name, value);
    }

    @JsonIgnore
    public boolean isCancelled() {
        return STATUS_CANCELLED.equals(status);
    }

    @JsonIgnore
    public boolean isAllDay() {
        return start != null && start.isAllDay();
    }

    public EventRecord copy() {
        EventRecord copy = new EventRecord();
        copy.id = id;
        copy.etag = etag;
        copy.icalUid = icalUid;
        copy.created = created;
        copy.updated = updated;
        copy.htmlLink = htmlLink;
        copy.hangoutLink = hangoutLink;
        copy.status = status;
        copy.summary = summary;
        copy.description = description;
        copy.location = location;
        copy.start = start;
        copy.end = end;
        copy.attendees = attendees != null ? new ArrayList<>(attendees) : null;
        copy.recurrence = recurrence != null ? new ArrayList<>(recurrence) : null;
        copy.recurringEventId = recurringEventId;
        copy.calendarId = calendarId;
        copy.additionalProperties.putAll(additionalProperties);
        return copy;
    }
}
