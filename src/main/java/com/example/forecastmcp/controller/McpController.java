package com.example.forecastmcp.controller;

import com.example.forecastmcp.model.JsonRpcRequest;
import com.example.forecastmcp.model.JsonRpcResponse;
import com.example.forecastmcp.model.ToolResult;
import com.example.forecastmcp.protocol.BearerTokenAuthenticator;
import com.example.forecastmcp.protocol.McpErrorCodes;
import com.example.forecastmcp.protocol.McpException;
import com.example.forecastmcp.protocol.McpMethod;
import com.example.forecastmcp.protocol.McpRequestDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping(path = "/mcp")
public class McpController {
    private static final Logger log = LoggerFactory.getLogger(McpController.class);

    private static final int PREVIEW_LENGTH = 300;
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final McpRequestDispatcher dispatcher;
    private final BearerTokenAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    public McpController(McpRequestDispatcher dispatcher,
                         BearerTokenAuthenticator authenticator,
                         ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonRpcResponse> handleHttp(
            @RequestBody(required = false) String body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        if (body == null || body.isBlank()) {
            return ResponseEntity.ok(JsonRpcResponse.failure(null, McpErrorCodes.PARSE_ERROR,
                    "Parse error: empty request body"));
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            log.warn("Parse error in /mcp: {}", ex.getOriginalMessage());
            return ResponseEntity.ok(JsonRpcResponse.failure(null, McpErrorCodes.PARSE_ERROR,
                    "Parse error: " + ex.getOriginalMessage()));
        }
        if (!root.isObject()) {
            return ResponseEntity.ok(JsonRpcResponse.failure(null, McpErrorCodes.INVALID_REQUEST,
                    "Invalid Request: expected a JSON object"));
        }

        JsonNode idNode = root.get("id");
        JsonNode methodNode = root.get("method");
        String method = methodNode != null && methodNode.isTextual() ? methodNode.asText() : null;
        Object id = readId(idNode);
        log.info("MCP request: method={} id={}", method, id);

        try {
            authenticator.authenticate(authorization);
        } catch (McpException ex) {
            log.warn("Rejected MCP request: method={} id={} reason={}", method, id, ex.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                    .body(JsonRpcResponse.failure(id, ex.getCode(), ex.getMessage()));
        }

        if (idNode == null || idNode.isNull()) {
            if (McpMethod.isNotification(method)) {
                log.info("Handled notification: {} (no response body)", method);
            } else {
                log.info("Unknown notification: {} (no response body)", method);
            }
            return ResponseEntity.noContent().build();
        }
        if (id == null) {
            return ResponseEntity.ok(JsonRpcResponse.failure(null, McpErrorCodes.INVALID_REQUEST,
                    "Invalid Request: id must be a string or a number"));
        }

        try {
            JsonRpcRequest request = toRequest(root, method, id);
            Object result = dispatcher.dispatch(request);
            logPreview(method, result);
            return ResponseEntity.ok(JsonRpcResponse.success(id, result));
        } catch (McpException ex) {
            log.info("MCP error for method={} id={}: {} {}", method, id, ex.getCode(), ex.getMessage());
            return ResponseEntity.ok(JsonRpcResponse.failure(id, ex.getCode(), ex.getMessage(), ex.getData()));
        } catch (Exception ex) {
            log.error("Unhandled error in /mcp for method={} id={}", method, id, ex);
            String detail = detail(ex);
            if (McpMethod.TOOLS_CALL.wireName().equals(method)) {
                return ResponseEntity.ok(JsonRpcResponse.success(id,
                        ToolResult.error("Internal tool error: " + detail)));
            }
            return ResponseEntity.ok(JsonRpcResponse.failure(id, McpErrorCodes.INTERNAL_ERROR,
                    "Internal error: " + detail));
        }
    }

    // String and number ids keep their JSON type; anything else yields null
    private Object readId(JsonNode idNode) {
        if (idNode == null || idNode.isNull()) {
            return null;
        }
        if (idNode.isTextual()) {
            return idNode.textValue();
        }
        if (idNode.isNumber()) {
            return idNode.numberValue();
        }
        return null;
    }

    private JsonRpcRequest toRequest(JsonNode root, String method, Object id) {
        JsonNode paramsNode = root.get("params");
        Map<String, Object> params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = Map.of();
        } else if (paramsNode.isObject()) {
            params = objectMapper.convertValue(paramsNode, OBJECT_TYPE);
        } else {
            throw new McpException(McpErrorCodes.INVALID_PARAMS, "Invalid params: params must be an object");
        }
        JsonRpcRequest request = new JsonRpcRequest(method, params, id);
        JsonNode jsonrpc = root.get("jsonrpc");
        if (jsonrpc != null && jsonrpc.isTextual()) {
            request.setJsonrpc(jsonrpc.textValue());
        }
        return request;
    }

    private void logPreview(String method, Object result) {
        if (!log.isDebugEnabled()
                || !(McpMethod.TOOLS_LIST.wireName().equals(method) || McpMethod.TOOLS_CALL.wireName().equals(method))) {
            return;
        }
        String preview;
        try {
            preview = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            preview = String.valueOf(result);
        }
        log.debug("{} result preview: {}", method,
                preview.length() > PREVIEW_LENGTH ? preview.substring(0, PREVIEW_LENGTH) : preview);
    }

    private static String detail(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
