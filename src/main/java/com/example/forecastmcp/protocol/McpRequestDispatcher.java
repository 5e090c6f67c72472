package com.example.forecastmcp.protocol;

import com.example.forecastmcp.config.ForecastMcpProperties;
import com.example.forecastmcp.model.JsonRpcRequest;
import com.example.forecastmcp.service.McpToolsService;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

@Component
public class McpRequestDispatcher {
    public static final String PROTOCOL_VERSION = "2024-11-05";

    private final Map<McpMethod, Function<Map<String, Object>, Object>> handlers = new EnumMap<>(McpMethod.class);
    private final Map<String, Object> initializeResult;

    public McpRequestDispatcher(McpToolsService mcpToolsService, ForecastMcpProperties properties) {
        this.initializeResult = Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "serverInfo", Map.of(
                        "name", properties.getServerName(),
                        "version", properties.getServerVersion()
                ),
                "capabilities", Map.of(
                        "tools", Map.of()
                )
        );
        handlers.put(McpMethod.INITIALIZE, params -> initializeResult);
        handlers.put(McpMethod.TOOLS_LIST, params -> mcpToolsService.listTools());
        handlers.put(McpMethod.TOOLS_CALL, mcpToolsService::callTool);
    }

    public Object dispatch(JsonRpcRequest request) {
        if (request == null || request.getMethod() == null || request.getMethod().isBlank()) {
            throw new McpException(McpErrorCodes.INVALID_REQUEST, "Invalid Request: missing method");
        }

        McpMethod method = McpMethod.fromWireName(request.getMethod())
                .orElseThrow(() -> new McpException(McpErrorCodes.METHOD_NOT_FOUND,
                        "Method not found: " + request.getMethod()));

        Map<String, Object> params = request.getParams() == null ? Map.of() : request.getParams();
        return handlers.get(method).apply(params);
    }
}
