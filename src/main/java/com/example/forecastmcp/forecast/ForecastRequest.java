package com.example.forecastmcp.forecast;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

public record ForecastRequest(List<LocalDateTime> ds, List<Double> y, int periods) {
    public static final int DEFAULT_PERIODS = 10;
    public static final int MAX_PERIODS = 10_000;

    public ForecastRequest {
        Objects.requireNonNull(ds, "ds");
        Objects.requireNonNull(y, "y");
        if (ds.size() != y.size()) {
            throw new IllegalArgumentException(
                    "ds and y must have the same length (ds has " + ds.size() + ", y has " + y.size() + ")");
        }
        if (ds.isEmpty()) {
            throw new IllegalArgumentException("ds and y must not be empty");
        }
        for (int i = 0; i < y.size(); i++) {
            Double value = y.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("y[" + i + "] must be a finite number");
            }
        }
        if (periods < 1) {
            throw new IllegalArgumentException("periods must be a positive integer");
        }
        if (periods > MAX_PERIODS) {
            throw new IllegalArgumentException("periods must be <= " + MAX_PERIODS);
        }
        ds = List.copyOf(ds);
        y = List.copyOf(y);
    }
}
