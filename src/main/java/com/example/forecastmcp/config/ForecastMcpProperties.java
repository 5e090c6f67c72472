package com.example.forecastmcp.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the forecast MCP server.
 *
 * <pre>
 * forecast-mcp:
 *   auth-token: ${MCP_TOKEN:}
 *   forecast:
 *     timeout: 30s
 *     worker-threads: 4
 * </pre>
 *
 * <p>An empty {@code auth-token} rejects every request.
 */
@Validated
@ConfigurationProperties(prefix = "forecast-mcp")
public class ForecastMcpProperties {

    private String authToken = "";

    @NotBlank
    private String serverName = "forecast_mcp";

    @NotBlank
    private String serverVersion = "0.1.0";

    @Valid
    private final Forecast forecast = new Forecast();

    public String getAuthToken() {
        return authToken;
    }

    public void setAuthToken(String authToken) {
        this.authToken = authToken;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public String getServerVersion() {
        return serverVersion;
    }

    public void setServerVersion(String serverVersion) {
        this.serverVersion = serverVersion;
    }

    public Forecast getForecast() {
        return forecast;
    }

    public static class Forecast {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @Positive
        private int workerThreads = 4;

        // Fraction of the predictive distribution covered by yhat_lower..yhat_upper
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double intervalWidth = 0.8;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public double getIntervalWidth() {
            return intervalWidth;
        }

        public void setIntervalWidth(double intervalWidth) {
            this.intervalWidth = intervalWidth;
        }
    }
}
