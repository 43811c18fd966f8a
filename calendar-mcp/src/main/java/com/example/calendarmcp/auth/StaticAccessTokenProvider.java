package com.example.calendarmcp.auth;

import com.example.calendarmcp.config.CalendarProperties;
import org.springframework.stereotype.Component;

@Component
public class StaticAccessTokenProvider implements AccessTokenProvider {
    private final CalendarProperties properties;

    public StaticAccessTokenProvider(CalendarProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getAccessToken() {
        String token = properties.getAuth().getAccessToken();
        if (token == null || token.isBlank()) {
            throw new AccessTokenException("No access token configured (calendar.auth.access-token)");
        }
        return token.trim();
    }
}
