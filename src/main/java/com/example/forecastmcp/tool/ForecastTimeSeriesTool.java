package com.example.forecastmcp.tool;

import com.example.forecastmcp.forecast.ForecastException;
import com.example.forecastmcp.forecast.ForecastRequest;
import com.example.forecastmcp.forecast.IsoTimestamps;
import com.example.forecastmcp.service.ForecastService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class ForecastTimeSeriesTool implements McpTool {
    public static final String NAME = "forecast_time_series";

    private static final Map<String, Object> INPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "ds", Map.of(
                            "type", "array",
                            "items", Map.of("type", "string"),
                            "description", "List of dates in ISO format (e.g., YYYY-MM-DD)."
                    ),
                    "y", Map.of(
                            "type", "array",
                            "items", Map.of("type", "number"),
                            "description", "List of numeric values aligned with ds."
                    ),
                    "periods", Map.of(
                            "type", "integer",
                            "description", "Number of future periods to forecast.",
                            "default", ForecastRequest.DEFAULT_PERIODS,
                            "minimum", 1,
                            "maximum", ForecastRequest.MAX_PERIODS
                    )
            ),
            "required", List.of("ds", "y"),
            "additionalProperties", false
    );

    private final ForecastService forecastService;

    public ForecastTimeSeriesTool(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Fits an additive trend + seasonality model on ds/y and returns ds + yhat/yhat_lower/yhat_upper "
                + "for the history and the requested number of future periods.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return INPUT_SCHEMA;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Override
    public Object invoke(Map<String, Object> arguments) {
        ForecastRequest request = toRequest(arguments);
        try {
            return forecastService.forecast(request);
        } catch (ForecastException ex) {
            throw new ToolExecutionException("Forecast failed: " + ex.getMessage(), ex);
        }
    }

    private ForecastRequest toRequest(Map<String, Object> arguments) {
        List<?> rawDs = (List<?>) arguments.get("ds");
        List<?> rawY = (List<?>) arguments.get("y");

        List<LocalDateTime> ds = new ArrayList<>(rawDs.size());
        for (int i = 0; i < rawDs.size(); i++) {
            String text = (String) rawDs.get(i);
            try {
                ds.add(IsoTimestamps.parse(text));
            } catch (DateTimeParseException ex) {
                throw new ToolExecutionException(
                        "Invalid arguments: ds[" + i + "] must be an ISO date or date-time, got '" + text + "'");
            }
        }

        List<Double> y = new ArrayList<>(rawY.size());
        for (Object value : rawY) {
            y.add(((Number) value).doubleValue());
        }

        Object rawPeriods = arguments.get("periods");
        int periods = rawPeriods == null ? ForecastRequest.DEFAULT_PERIODS : toPeriods((Number) rawPeriods);

        try {
            return new ForecastRequest(ds, y, periods);
        } catch (IllegalArgumentException ex) {
            throw new ToolExecutionException("Invalid arguments: " + ex.getMessage());
        }
    }

    // Exact conversion; anything outside the int range must not wrap into a different horizon
    private static int toPeriods(Number rawPeriods) {
        try {
            return new BigDecimal(rawPeriods.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException ex) {
            throw new ToolExecutionException("Invalid arguments: periods must be an integer between 1 and "
                    + ForecastRequest.MAX_PERIODS + ", got " + rawPeriods);
        }
    }
}
