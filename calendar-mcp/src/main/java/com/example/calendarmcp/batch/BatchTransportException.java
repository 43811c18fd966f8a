package com.example.calendarmcp.batch;

public class BatchTransportException extends RuntimeException {
    private final int statusCode;

    public BatchTransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
