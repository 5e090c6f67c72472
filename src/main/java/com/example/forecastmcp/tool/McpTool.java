package com.example.forecastmcp.tool;

import java.util.Map;

public interface McpTool {
    String getName();

    String getDescription();

    Map<String, Object> getInputSchema();

    boolean isReadOnly();

    /**
     * @param arguments arguments already validated against {@link #getInputSchema()}
     * @return output serialized to JSON as the text content of the tool result
     * @throws ToolExecutionException for failures that should be reported to the client as a tool error
     */
    Object invoke(Map<String, Object> arguments);

    default ToolDescriptor describe() {
        return new ToolDescriptor(getName(), getDescription(), getInputSchema(),
                Map.of("read_only", isReadOnly()));
    }
}
