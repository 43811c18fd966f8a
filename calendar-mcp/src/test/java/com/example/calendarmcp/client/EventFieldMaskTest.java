package com.example.calendarmcp.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFieldMaskTest {

    @Test
    void noRequestedFieldsMeansNoMask() {
        assertThat(EventFieldMask.forEvent(null)).isNull();
        assertThat(EventFieldMask.forList(List.of())).isNull();
    }

    @Test
    void singleEventMaskAddsRequestedAfterDefaults() {
        assertThat(EventFieldMask.forEvent(List.of("description", "id", "reminders")))
                .isEqualTo("id,summary,start,end,status,htmlLink,location,attendees,description,reminders");
    }

    @Test
    void listMaskWrapsItemsAndKeepsEnvelope() {
        assertThat(EventFieldMask.forList(List.of("colorId")))
                .isEqualTo("items(id,summary,start,end,status,htmlLink,location,attendees,colorId),"
                        + "nextPageToken,nextSyncToken,kind,etag,summary,updated,timeZone,accessRole,defaultReminders");
    }

    @Test
    void namesEveryInvalidField() {
        assertThatThrownBy(() -> EventFieldMask.forList(List.of("summary", "body", "secret")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid fields requested: body, secret. Allowed fields: id, summary, description");
    }
}
