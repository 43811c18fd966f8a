package com.example.calendarmcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(
        String jsonrpc,
        String method,
        Map<String, Object> params,
        Object id
) {
    public boolean isNotification() {
        return id == null;
    }
}
