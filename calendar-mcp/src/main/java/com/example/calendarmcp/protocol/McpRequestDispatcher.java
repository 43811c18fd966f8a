package com.example.calendarmcp.protocol;

import com.example.calendarmcp.model.JsonRpcRequest;
import com.example.calendarmcp.service.McpToolsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class McpRequestDispatcher {
    static final String PROTOCOL_VERSION = "2025-06-18";

    private final McpToolsService mcpToolsService;
    private final String serverName;
    private final String serverVersion;

    public McpRequestDispatcher(McpToolsService mcpToolsService,
                                @Value("${spring.application.name:calendar-mcp}") String serverName,
                                @Value("${calendar.server.version:0.1.0}") String serverVersion) {
        this.mcpToolsService = mcpToolsService;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    public Object dispatch(JsonRpcRequest request) {
        if (request == null || request.method() == null || request.method().isBlank()) {
            throw new McpException(McpErrorCodes.INVALID_REQUEST, "Missing method in request");
        }
        if (!"2.0".equals(request.jsonrpc())) {
            throw new McpException(McpErrorCodes.INVALID_REQUEST, "Only JSON-RPC 2.0 is supported");
        }
        log.debug("Dispatching {} (id={})", request.method(), request.id());

        return switch (request.method()) {
            case "initialize" -> handleInitialize();
            case "ping" -> Map.of();
            case "notifications/initialized", "initialized" -> Map.of();
            case "tools/list" -> mcpToolsService.listTools();
            case "tools/call" -> mcpToolsService.callTool(request.params());
            default -> throw new McpException(McpErrorCodes.METHOD_NOT_FOUND,
                    "Method not found: " + request.method());
        };
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "serverInfo", Map.of(
                        "name", serverName,
                        "version", serverVersion
                ),
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false)
                )
        );
    }
}
