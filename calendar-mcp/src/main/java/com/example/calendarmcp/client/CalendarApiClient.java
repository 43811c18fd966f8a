package com.example.calendarmcp.client;

import com.example.calendarmcp.auth.AccessTokenProvider;
import com.example.calendarmcp.config.CalendarProperties;
import com.example.calendarmcp.model.EventRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class CalendarApiClient {
    private static final String DEFAULT_TIME_ZONE = "UTC";

    private final RestTemplate restTemplate;
    private final AccessTokenProvider accessTokenProvider;
    private final ObjectMapper objectMapper;
    private final CalendarProperties properties;

    public CalendarApiClient(RestTemplate restTemplate,
                             AccessTokenProvider accessTokenProvider,
                             ObjectMapper objectMapper,
                             CalendarProperties properties) {
        this.restTemplate = restTemplate;
        this.accessTokenProvider = accessTokenProvider;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public List<EventRecord> listEvents(String calendarId, EventListQuery query) {
        JsonNode response = exchange(HttpMethod.GET, query.pathFor(calendarId), null);
        return toEvents(response, calendarId);
    }

    public EventRecord getEvent(String calendarId, String eventId) {
        return getEvent(calendarId, eventId, null);
    }

    public EventRecord getEvent(String calendarId, String eventId, String fieldMask) {
        String path = CalendarPaths.event(calendarId, eventId);
        if (fieldMask != null) {
            path += "?fields=" + CalendarPaths.encode(fieldMask);
        }
        return toEvent(exchange(HttpMethod.GET, path, null), calendarId);
    }

    public EventRecord insertEvent(String calendarId, EventRecord event) {
        String path = CalendarPaths.events(calendarId) + writeOptions(event);
        return toEvent(exchange(HttpMethod.POST, path, event), calendarId);
    }

    public EventRecord patchEvent(String calendarId, String eventId, EventRecord patch) {
        String path = CalendarPaths.event(calendarId, eventId) + writeOptions(patch);
        return toEvent(exchange(HttpMethod.PATCH, path, patch), calendarId);
    }

    public void deleteEvent(String calendarId, String eventId) {
        exchange(HttpMethod.DELETE, CalendarPaths.event(calendarId, eventId), null);
    }

    // UTC when the calendar cannot be read.
    public String getCalendarTimeZone(String calendarId) {
        try {
            JsonNode entry = exchange(HttpMethod.GET, CalendarPaths.calendarListEntry(calendarId), null);
            String zone = entry != null ? entry.path("timeZone").asText(null) : null;
            return zone != null && !zone.isBlank() ? zone : DEFAULT_TIME_ZONE;
        } catch (CalendarApiException ex) {
            log.debug("Falling back to UTC for calendar {}: {}", calendarId, ex.getMessage());
            return DEFAULT_TIME_ZONE;
        }
    }

    public List<JsonNode> listCalendars() {
        JsonNode response = exchange(HttpMethod.GET, CalendarPaths.calendarList(), null);
        List<JsonNode> calendars = new ArrayList<>();
        if (response != null) {
            response.path("items").forEach(calendars::add);
        }
        return calendars;
    }

    public JsonNode getColors() {
        return exchange(HttpMethod.GET, CalendarPaths.colors(), null);
    }

    public JsonNode queryFreeBusy(String timeMin, String timeMax, String timeZone, List<String> calendarIds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timeMin", timeMin);
        body.put("timeMax", timeMax);
        if (timeZone != null) {
            body.put("timeZone", timeZone);
        }
        body.put("items", calendarIds.stream().map(id -> Map.of("id", id)).toList());
        return exchange(HttpMethod.POST, CalendarPaths.freeBusy(), body);
    }

    public List<EventRecord> toEvents(JsonNode response, String calendarId) {
        List<EventRecord> events = new ArrayList<>();
        if (response == null) {
            return events;
        }
        JsonNode items = response.path("items");
        if (items.isArray()) {
            items.forEach(item -> events.add(toEvent(item, calendarId)));
        }
        return events;
    }

    private EventRecord toEvent(JsonNode node, String calendarId) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        EventRecord event = objectMapper.convertValue(node, EventRecord.class);
        event.setCalendarId(calendarId);
        return event;
    }

    private String writeOptions(EventRecord event) {
        List<String> options = new ArrayList<>();
        if (event.getAdditionalProperties().get("conferenceData") != null) {
            options.add("conferenceDataVersion=1");
        }
        if (event.getAdditionalProperties().get("attachments") != null) {
            options.add("supportsAttachments=true");
        }
        return options.isEmpty() ? "" : "?" + String.join("&", options);
    }

    private JsonNode exchange(HttpMethod method, String path, Object body) {
        URI uri = URI.create(properties.getApi().getBaseUrl() + path);
        RequestEntity.BodyBuilder builder = RequestEntity.method(method, uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessTokenProvider.getAccessToken())
                .accept(MediaType.APPLICATION_JSON);
        RequestEntity<?> request = body != null
                ? builder.contentType(MediaType.APPLICATION_JSON).body(body)
                : builder.build();
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(request, JsonNode.class);
            return response.getBody();
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            throw new CalendarApiException(status, errorMessage(status, ex.getResponseBodyAsString()), ex);
        } catch (ResourceAccessException ex) {
            throw new CalendarApiException(0, "Calendar API unreachable: " + ex.getMessage(), ex);
        }
    }

    private String errorMessage(int status, String responseBody) {
        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JsonNode message = objectMapper.readTree(responseBody).path("error").path("message");
                if (message.isTextual()) {
                    return message.asText();
                }
            } catch (JsonProcessingException ex) {
                log.debug("Error body is not JSON: {}", ex.getOriginalMessage());
            }
        }
        return "HTTP " + status;
    }
}
