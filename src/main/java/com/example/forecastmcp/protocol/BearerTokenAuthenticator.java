package com.example.forecastmcp.protocol;

import com.example.forecastmcp.config.ForecastMcpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
public class BearerTokenAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticator.class);

    static final String BEARER_PREFIX = "Bearer ";
    static final String MISSING_HEADER_MESSAGE = "Unauthorized: Missing or invalid Authorization header";
    static final String INVALID_TOKEN_MESSAGE = "Unauthorized: Invalid MCP Auth token";

    private final byte[] expectedToken;

    public BearerTokenAuthenticator(ForecastMcpProperties properties) {
        String token = properties.getAuthToken();
        if (token == null || token.isEmpty()) {
            log.warn("No MCP auth token configured (forecast-mcp.auth-token / MCP_TOKEN); every request will be rejected");
            this.expectedToken = null;
        } else {
            this.expectedToken = token.getBytes(StandardCharsets.UTF_8);
        }
    }

    public void authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new McpException(McpErrorCodes.UNAUTHORIZED, MISSING_HEADER_MESSAGE);
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length());
        if (token.isEmpty()) {
            throw new McpException(McpErrorCodes.UNAUTHORIZED, MISSING_HEADER_MESSAGE);
        }
        if (expectedToken == null
                || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            throw new McpException(McpErrorCodes.UNAUTHORIZED, INVALID_TOKEN_MESSAGE);
        }
    }
}
