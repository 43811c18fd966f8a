package com.example.calendarmcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(
        String jsonrpc,
        Object result,
        JsonRpcError error,
        Object id
) {
    private static final String VERSION = "2.0";

    public static JsonRpcResponse success(Object id, Object result) {
        return new JsonRpcResponse(VERSION, result, null, id);
    }

    public static JsonRpcResponse failure(Object id, int code, String message, Object data) {
        return new JsonRpcResponse(VERSION, null, new JsonRpcError(code, message, data), id);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JsonRpcError(int code, String message, Object data) {
    }
}
