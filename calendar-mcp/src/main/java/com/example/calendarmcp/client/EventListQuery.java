package com.example.calendarmcp.client;

import java.util.ArrayList;
import java.util.List;

public record EventListQuery(
        String timeMin,
        String timeMax,
        String timeZone,
        Integer maxResults,
        List<String> privateExtendedProperty,
        List<String> sharedExtendedProperty,
        String query,
        String fields
) {

    public static EventListQuery between(String timeMin, String timeMax) {
        return new EventListQuery(timeMin, timeMax, null, null, null, null, null, null);
    }

    public EventListQuery withTimeZone(String zone) {
        return new EventListQuery(timeMin, timeMax, zone, maxResults, privateExtendedProperty, sharedExtendedProperty,
                query, fields);
    }

    public EventListQuery withMaxResults(Integer max) {
        return new EventListQuery(timeMin, timeMax, timeZone, max, privateExtendedProperty, sharedExtendedProperty,
                query, fields);
    }

    public EventListQuery withExtendedProperties(List<String> privateFilters, List<String> sharedFilters) {
        return new EventListQuery(timeMin, timeMax, timeZone, maxResults, privateFilters, sharedFilters, query, fields);
    }

    public EventListQuery withQuery(String text) {
        return new EventListQuery(timeMin, timeMax, timeZone, maxResults, privateExtendedProperty,
                sharedExtendedProperty, text, fields);
    }

    public EventListQuery withFields(String fieldMask) {
        return new EventListQuery(timeMin, timeMax, timeZone, maxResults, privateExtendedProperty,
                sharedExtendedProperty, query, fieldMask);
    }

    public String toQueryString() {
        List<String> params = new ArrayList<>();
        params.add("singleEvents=true");
        params.add("orderBy=startTime");
        add(params, "timeMin", timeMin);
        add(params, "timeMax", timeMax);
        add(params, "timeZone", timeZone);
        if (maxResults != null) {
            add(params, "maxResults", maxResults.toString());
        }
        add(params, "q", query);
        if (privateExtendedProperty != null) {
            privateExtendedProperty.forEach(value -> add(params, "privateExtendedProperty", value));
        }
        if (sharedExtendedProperty != null) {
            sharedExtendedProperty.forEach(value -> add(params, "sharedExtendedProperty", value));
        }
        add(params, "fields", fields);
        return String.join("&", params);
    }

    public String pathFor(String calendarId) {
        return CalendarPaths.events(calendarId) + "?" + toQueryString();
    }

    private static void add(List<String> params, String name, String value) {
        if (value != null && !value.isBlank()) {
            params.add(name + "=" + CalendarPaths.encode(value));
        }
    }
}
