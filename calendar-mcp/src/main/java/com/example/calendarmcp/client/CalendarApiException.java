package com.example.calendarmcp.client;

// statusCode is 0 when no response was received.
public class CalendarApiException extends RuntimeException {
    private final int statusCode;

    public CalendarApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
