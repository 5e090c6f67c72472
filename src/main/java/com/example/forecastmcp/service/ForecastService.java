package com.example.forecastmcp.service;

import com.example.forecastmcp.config.ForecastMcpProperties;
import com.example.forecastmcp.forecast.ForecastEngine;
import com.example.forecastmcp.forecast.ForecastException;
import com.example.forecastmcp.forecast.ForecastRequest;
import com.example.forecastmcp.forecast.ForecastResult;
import com.example.forecastmcp.forecast.ForecastTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class ForecastService {
    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final ForecastEngine forecastEngine;
    private final ExecutorService forecastExecutor;
    private final Duration timeout;

    public ForecastService(ForecastEngine forecastEngine,
                           @Qualifier("forecastExecutor") ExecutorService forecastExecutor,
                           ForecastMcpProperties properties) {
        this.forecastEngine = forecastEngine;
        this.forecastExecutor = forecastExecutor;
        this.timeout = properties.getForecast().getTimeout();
    }

    public ForecastResult forecast(ForecastRequest request) throws ForecastException {
        long started = System.nanoTime();
        Future<ForecastResult> future = forecastExecutor.submit(() -> forecastEngine.forecast(request));
        try {
            ForecastResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Forecast of {} rows (+{} periods) finished in {} ms",
                    request.ds().size(), request.periods(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Forecast of {} rows cancelled after {} ms", request.ds().size(), timeout.toMillis());
            throw new ForecastTimeoutException(timeout);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for forecast", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ForecastException forecastException) {
                throw forecastException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Forecast failed: " + cause.getMessage(), cause);
        }
    }
}
