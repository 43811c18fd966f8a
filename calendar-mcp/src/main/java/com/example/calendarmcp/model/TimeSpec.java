package com.example.calendarmcp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeSpec(String dateTime, String date, String timeZone) {

    public static TimeSpec ofDateTime(String dateTime) {
        return new TimeSpec(dateTime, null, null);
    }

    public static TimeSpec ofDateTime(String dateTime, String timeZone) {
        return new TimeSpec(dateTime, null, timeZone);
    }

    public static TimeSpec ofDate(String date) {
        return new TimeSpec(null, date, null);
    }

    public static TimeSpec ofZone(String timeZone) {
        return new TimeSpec(null, null, timeZone);
    }

    @JsonIgnore
    public boolean isAllDay() {
        return dateTime == null && date != null;
    }

    @JsonIgnore
    public String value() {
        return dateTime != null ? dateTime : date;
    }

    public TimeSpec withTimeZone(String zone) {
        return new TimeSpec(dateTime, date, zone);
    }
}
