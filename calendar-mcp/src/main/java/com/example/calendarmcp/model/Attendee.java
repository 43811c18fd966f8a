package com.example.calendarmcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Attendee(
        String email,
        String displayName,
        String responseStatus,
        Boolean self,
        Boolean optional,
        Boolean organizer
) {
}
