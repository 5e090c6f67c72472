package com.example.forecastmcp.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"meta", "forecast"})
public record ForecastResult(Meta meta, List<Point> forecast) {

    @JsonPropertyOrder({"periods", "n_history", "start", "end"})
    public record Meta(
            int periods,
            @JsonProperty("n_history") int nHistory,
            String start,
            String end
    ) {
    }

    @JsonPropertyOrder({"ds", "yhat", "yhat_lower", "yhat_upper"})
    public record Point(
            String ds,
            double yhat,
            @JsonProperty("yhat_lower") double yhatLower,
            @JsonProperty("yhat_upper") double yhatUpper
    ) {
    }
}
