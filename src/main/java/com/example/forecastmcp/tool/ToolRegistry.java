package com.example.forecastmcp.tool;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ToolRegistry {
    private final Map<String, McpTool> toolMap;
    private final List<ToolDescriptor> descriptors;

    public ToolRegistry(List<McpTool> tools) {
        Map<String, McpTool> byName = new LinkedHashMap<>();
        tools.stream()
                .sorted(Comparator.comparing(McpTool::getName, String.CASE_INSENSITIVE_ORDER))
                .forEach(tool -> {
                    if (byName.putIfAbsent(tool.getName(), tool) != null) {
                        throw new IllegalStateException("Duplicate tool name: " + tool.getName());
                    }
                });
        this.toolMap = Map.copyOf(byName);
        this.descriptors = byName.values().stream().map(McpTool::describe).toList();
    }

    public List<ToolDescriptor> descriptors() {
        return descriptors;
    }

    public Optional<McpTool> findByName(String name) {
        return Optional.ofNullable(name).map(toolMap::get);
    }
}
