package com.example.forecastmcp.forecast;

@FunctionalInterface
public interface ForecastEngine {

    ForecastResult forecast(ForecastRequest request) throws ForecastException;
}
