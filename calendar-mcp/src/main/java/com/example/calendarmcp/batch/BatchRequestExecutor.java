package com.example.calendarmcp.batch;

import com.example.calendarmcp.auth.AccessTokenProvider;
import com.example.calendarmcp.config.CalendarProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

@Slf4j
@Component
public class BatchRequestExecutor {
    private static final int TOO_MANY_REQUESTS = 429;

    private final RestTemplate restTemplate;
    private final BatchProtocolCodec codec;
    private final AccessTokenProvider accessTokenProvider;
    private final CalendarProperties properties;

    public BatchRequestExecutor(RestTemplate restTemplate,
                                BatchProtocolCodec codec,
                                AccessTokenProvider accessTokenProvider,
                                CalendarProperties properties) {
        this.restTemplate = restTemplate;
        this.codec = codec;
        this.accessTokenProvider = accessTokenProvider;
        this.properties = properties;
    }

    public List<BatchResponse> execute(List<BatchRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        int maxRequests = properties.getBatch().getMaxRequests();
        if (requests.size() > maxRequests) {
            throw new IllegalArgumentException(
                    "Batch requests cannot exceed " + maxRequests + " requests per batch");
        }

        String token = accessTokenProvider.getAccessToken();
        String boundary = codec.newBoundary();
        byte[] payload = codec.encode(requests, boundary).getBytes(StandardCharsets.UTF_8);
        RequestEntity<byte[]> request = RequestEntity.post(batchUri())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.parseMediaType("multipart/mixed; boundary=" + boundary))
                .body(payload);

        int maxRetries = properties.getBatch().getMaxRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                ResponseEntity<byte[]> response = restTemplate.exchange(request, byte[].class);
                String body = response.getBody() != null
                        ? new String(response.getBody(), StandardCharsets.UTF_8)
                        : "";
                List<BatchResponse> results = codec.decode(body, response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
                if (results.size() != requests.size()) {
                    log.warn("Batch returned {} parts for {} requests", results.size(), requests.size());
                }
                return results;
            } catch (HttpStatusCodeException ex) {
                int status = ex.getStatusCode().value();
                if (status == TOO_MANY_REQUESTS && attempt < maxRetries) {
                    Duration delay = retryAfter(ex.getResponseHeaders(), attempt);
                    log.warn("Batch rate limited, retrying after {} ms (attempt {}/{})",
                            delay.toMillis(), attempt + 1, maxRetries);
                    pause(delay);
                    continue;
                }
                throw new BatchTransportException(
                        "Batch request failed: HTTP " + status + " " + ex.getStatusText(), status, ex);
            } catch (ResourceAccessException ex) {
                if (attempt < maxRetries) {
                    Duration delay = backoff(attempt);
                    log.warn("Batch exchange failed, retrying after {} ms (attempt {}/{}): {}",
                            delay.toMillis(), attempt + 1, maxRetries, ex.getMessage());
                    pause(delay);
                    continue;
                }
                throw new BatchTransportException(
                        "Failed to execute batch request after " + (attempt + 1) + " attempts: " + ex.getMessage(),
                        0, ex);
            }
        }
    }

    private URI batchUri() {
        return URI.create(properties.getApi().getBaseUrl() + properties.getApi().getBatchPath());
    }

    private Duration retryAfter(HttpHeaders headers, int attempt) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(value.trim()));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring non-numeric Retry-After '{}'", value);
            }
        }
        return backoff(attempt);
    }

    private Duration backoff(int attempt) {
        return properties.getBatch().getBaseDelay().multipliedBy(1L << attempt);
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BatchTransportException("Interrupted while waiting to retry batch request", 0, ex);
        }
    }
}
