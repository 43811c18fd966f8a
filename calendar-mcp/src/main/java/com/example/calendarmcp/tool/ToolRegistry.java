package com.example.calendarmcp.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class ToolRegistry {
    private final Map<String, McpTool> toolMap = new ConcurrentHashMap<>();

    public ToolRegistry(List<McpTool> tools) {
        tools.forEach(tool -> {
            if (toolMap.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        });
        log.info("Registered {} tools: {}", toolMap.size(), toolMap.keySet());
    }

    public List<McpTool> list() {
        return toolMap.values().stream().sorted(Comparator.comparing(McpTool::getName)).toList();
    }

    public Optional<McpTool> findByName(String name) {
        return Optional.ofNullable(toolMap.get(name));
    }
}
