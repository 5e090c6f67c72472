package com.example.forecastmcp.tool;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"name", "description", "annotations", "inputSchema"})
public record ToolDescriptor(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Map<String, Object> annotations
) {
}
