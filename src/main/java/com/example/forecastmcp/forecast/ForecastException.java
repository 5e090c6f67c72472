package com.example.forecastmcp.forecast;

public class ForecastException extends Exception {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
