package com.example.calendarmcp.batch;

import java.util.Map;

public record BatchRequest(String method, String path, Map<String, String> headers, Object body) {

    public static BatchRequest get(String path) {
        return new BatchRequest("GET", path, null, null);
    }
}
