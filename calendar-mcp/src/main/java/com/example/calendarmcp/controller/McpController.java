package com.example.calendarmcp.controller;

import com.example.calendarmcp.model.JsonRpcRequest;
import com.example.calendarmcp.model.JsonRpcResponse;
import com.example.calendarmcp.protocol.McpException;
import com.example.calendarmcp.protocol.McpRequestDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping(path = "/mcp")
public class McpController {
    private final McpRequestDispatcher dispatcher;

    public McpController(McpRequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonRpcResponse> handleHttp(@RequestBody JsonRpcRequest request) {
        if (request.isNotification()) {
            try {
                dispatcher.dispatch(request);
            } catch (McpException ex) {
                log.debug("Notification {} failed: {}", request.method(), ex.getMessage());
            }
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }

        try {
            return ResponseEntity.ok(JsonRpcResponse.success(request.id(), dispatcher.dispatch(request)));
        } catch (McpException ex) {
            return ResponseEntity.ok(JsonRpcResponse.failure(request.id(), ex.getCode(), ex.getMessage(), ex.getData()));
        }
    }
}
