package com.example.calendarmcp.controller;

import com.example.calendarmcp.model.JsonRpcResponse;
import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(McpException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleMcpException(McpException ex) {
        log.debug("MCP error {}: {}", ex.getCode(), ex.getMessage());
        return JsonRpcResponse.failure(null, ex.getCode(), ex.getMessage(), ex.getData());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleInvalidJson(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request: {}", ex.getMessage());
        return JsonRpcResponse.failure(null, McpErrorCodes.PARSE_ERROR, "Invalid JSON payload", null);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleUnhandledException(Exception ex) {
        log.error("Unhandled error while processing request", ex);
        return JsonRpcResponse.failure(null, McpErrorCodes.INTERNAL_ERROR, "Internal server error", null);
    }
}
