package com.example.calendarmcp.config;

import com.example.calendarmcp.conflict.DuplicateThresholds;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class CalendarClientConfig {

    @Bean
    public RestTemplate calendarRestTemplate(CalendarProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getApi().getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getApi().getReadTimeout());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public DuplicateThresholds duplicateThresholds(CalendarProperties properties) {
        return properties.getConflict().toThresholds();
    }
}
