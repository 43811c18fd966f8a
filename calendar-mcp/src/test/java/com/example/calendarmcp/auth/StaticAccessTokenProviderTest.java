package com.example.calendarmcp.auth;

import com.example.calendarmcp.config.CalendarProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticAccessTokenProviderTest {

    @Test
    void returnsConfiguredToken() {
        CalendarProperties properties = new CalendarProperties();
        properties.getAuth().setAccessToken(" ya29.token \n");

        assertThat(new StaticAccessTokenProvider(properties).getAccessToken()).isEqualTo("ya29.token");
    }

    @Test
    void failsWithoutToken() {
        StaticAccessTokenProvider provider = new StaticAccessTokenProvider(new CalendarProperties());

        assertThatThrownBy(provider::getAccessToken)
                .isInstanceOf(AccessTokenException.class)
                .hasMessageContaining("calendar.auth.access-token");
    }
}
