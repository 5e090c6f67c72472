package com.example.forecastmcp.forecast;

import java.time.Duration;

public class ForecastTimeoutException extends RuntimeException {

    public ForecastTimeoutException(Duration timeout) {
        super("Forecast timed out after " + timeout.toMillis() + " ms");
    }
}
