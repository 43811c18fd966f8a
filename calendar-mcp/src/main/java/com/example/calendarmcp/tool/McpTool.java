package com.example.calendarmcp.tool;

import java.util.Map;

public interface McpTool {
    String getName();

    String getDescription();

    Map<String, Object> getInputSchema();

    Map<String, Object> invoke(Map<String, Object> arguments);
}
