package com.example.calendarmcp.config;

import com.example.calendarmcp.conflict.DuplicateThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "calendar")
@Data
public class CalendarProperties {

    private ApiProperties api = new ApiProperties();
    private BatchProperties batch = new BatchProperties();
    private ConflictProperties conflict = new ConflictProperties();
    private AuthProperties auth = new AuthProperties();

    @Data
    public static class ApiProperties {
        private String baseUrl = "https://www.googleapis.com";
        private String batchPath = "/batch/calendar/v3";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class BatchProperties {
        private int maxRequests = 50;
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class ConflictProperties {
        private double warningThreshold = 0.7;
        private double blockingThreshold = 0.95;

        public DuplicateThresholds toThresholds() {
            return new DuplicateThresholds(warningThreshold, blockingThreshold);
        }
    }

    @Data
    public static class AuthProperties {
        private String accessToken;
    }
}
