package com.example.forecastmcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(List<TextContent> content, @JsonProperty("isError") Boolean isError) {

    public static ToolResult success(String text) {
        return new ToolResult(List.of(TextContent.of(text)), null);
    }

    public static ToolResult error(String text) {
        return new ToolResult(List.of(TextContent.of(text)), Boolean.TRUE);
    }
}
