package com.example.calendarmcp.service;

import com.example.calendarmcp.auth.AccessTokenException;
import com.example.calendarmcp.batch.BatchTransportException;
import com.example.calendarmcp.client.CalendarApiException;
import com.example.calendarmcp.protocol.McpErrorCodes;
import com.example.calendarmcp.protocol.McpException;
import com.example.calendarmcp.tool.McpTool;
import com.example.calendarmcp.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class McpToolsService {
    private final ToolRegistry toolRegistry;

    public McpToolsService(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public Map<String, Object> listTools() {
        List<Map<String, Object>> tools = toolRegistry.list().stream()
                .map(tool -> Map.<String, Object>of(
                        "name", tool.getName(),
                        "description", tool.getDescription(),
                        "inputSchema", tool.getInputSchema()
                ))
                .toList();
        return Map.of("tools", tools);
    }

    @SuppressWarnings("unchecked")
    public Object callTool(Map<String, Object> params) {
        if (params == null) {
            throw new McpException(McpErrorCodes.INVALID_PARAMS, "tools/call requires params");
        }

        Object rawToolName = params.get("name");
        if (!(rawToolName instanceof String toolName) || toolName.isBlank()) {
            throw new McpException(McpErrorCodes.INVALID_PARAMS, "tools/call requires non-empty name");
        }

        Object rawArguments = params.getOrDefault("arguments", new HashMap<String, Object>());
        if (!(rawArguments instanceof Map<?, ?> mapArguments)) {
            throw new McpException(McpErrorCodes.INVALID_PARAMS, "tools/call arguments must be object");
        }

        Map<String, Object> arguments = (Map<String, Object>) mapArguments;
        McpTool tool = toolRegistry.findByName(toolName)
                .orElseThrow(() -> new McpException(McpErrorCodes.TOOL_NOT_FOUND,
                        "Tool not found: " + toolName));

        try {
            return tool.invoke(arguments);
        } catch (McpException ex) {
            throw ex;
        } catch (CalendarApiException ex) {
            log.warn("{} failed with calendar API status {}: {}", toolName, ex.getStatusCode(), ex.getMessage());
            int code = ex.isClientError() ? McpErrorCodes.INVALID_PARAMS : McpErrorCodes.UPSTREAM_ERROR;
            throw new McpException(code, ex.getMessage(), Map.of("statusCode", ex.getStatusCode()), ex);
        } catch (BatchTransportException ex) {
            log.warn("{} failed in batch transport: {}", toolName, ex.getMessage());
            throw new McpException(McpErrorCodes.UPSTREAM_ERROR, ex.getMessage(),
                    Map.of("statusCode", ex.getStatusCode()), ex);
        } catch (AccessTokenException ex) {
            log.warn("{} failed to obtain an access token: {}", toolName, ex.getMessage());
            throw new McpException(McpErrorCodes.AUTH_ERROR, "Authentication failed: " + ex.getMessage(), null, ex);
        } catch (IllegalArgumentException ex) {
            throw new McpException(McpErrorCodes.INVALID_PARAMS, ex.getMessage(), null, ex);
        }
    }
}
