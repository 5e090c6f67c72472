package com.example.forecastmcp.service;

import com.example.forecastmcp.model.ToolResult;
import com.example.forecastmcp.tool.InputSchemaValidator;
import com.example.forecastmcp.tool.McpTool;
import com.example.forecastmcp.tool.ToolExecutionException;
import com.example.forecastmcp.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class McpToolsService {
    private static final Logger log = LoggerFactory.getLogger(McpToolsService.class);

    static final String INVALID_ARGUMENTS_MESSAGE = "Invalid arguments: expected object or JSON string.";
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final InputSchemaValidator schemaValidator;
    private final ObjectMapper objectMapper;

    public McpToolsService(ToolRegistry toolRegistry, InputSchemaValidator schemaValidator, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.schemaValidator = schemaValidator;
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> listTools() {
        return Map.of("tools", toolRegistry.descriptors());
    }

    public ToolResult callTool(Map<String, Object> params) {
        Object rawToolName = params.get("name");
        if (!(rawToolName instanceof String toolName)) {
            return ToolResult.error("Invalid params: tools/call requires a tool name");
        }

        Map<String, Object> arguments = decodeArguments(params.get("arguments"));
        if (arguments == null) {
            return ToolResult.error(INVALID_ARGUMENTS_MESSAGE);
        }

        McpTool tool = toolRegistry.findByName(toolName).orElse(null);
        if (tool == null) {
            log.info("tools/call for unknown tool '{}'", toolName);
            return ToolResult.error("Tool not found: " + toolName);
        }

        List<String> violations = schemaValidator.validate(tool.getInputSchema(), arguments);
        if (!violations.isEmpty()) {
            return ToolResult.error("Invalid arguments: " + String.join("; ", violations));
        }

        Object output;
        try {
            output = tool.invoke(arguments);
        } catch (ToolExecutionException ex) {
            log.info("Tool '{}' reported an error: {}", toolName, ex.getMessage());
            return ToolResult.error(ex.getMessage());
        }

        try {
            return ToolResult.success(objectMapper.writeValueAsString(output));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize output of tool " + toolName, ex);
        }
    }

    // null when the arguments are neither an object nor a string holding a JSON object
    @SuppressWarnings("unchecked")
    private Map<String, Object> decodeArguments(Object rawArguments) {
        if (rawArguments == null) {
            return Map.of();
        }
        if (rawArguments instanceof Map<?, ?> mapArguments) {
            return (Map<String, Object>) mapArguments;
        }
        if (rawArguments instanceof String text) {
            try {
                return objectMapper.readValue(text, OBJECT_TYPE);
            } catch (JsonProcessingException ex) {
                log.debug("tools/call arguments are not a JSON object: {}", ex.getOriginalMessage());
                return null;
            }
        }
        return null;
    }
}
