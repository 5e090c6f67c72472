package com.example.forecastmcp.controller;

import com.example.forecastmcp.model.JsonRpcResponse;
import com.example.forecastmcp.protocol.McpErrorCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // McpController reads the body as a String, so this is reached only when reading the stream fails
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable /mcp request body: {}", ex.getMessage());
        return JsonRpcResponse.failure(null, McpErrorCodes.PARSE_ERROR, "Parse error: " + ex.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.OK)
    public JsonRpcResponse handleUnhandledException(RuntimeException ex) {
        log.error("Unhandled error outside JSON-RPC dispatch", ex);
        String detail = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return JsonRpcResponse.failure(null, McpErrorCodes.INTERNAL_ERROR, "Internal error: " + detail);
    }
}
