package com.example.forecastmcp.config;

import com.example.forecastmcp.forecast.AdditiveRegressionForecastEngine;
import com.example.forecastmcp.forecast.ForecastEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(ForecastMcpProperties.class)
public class ForecastMcpConfiguration {

    @Bean
    public ForecastEngine forecastEngine(ForecastMcpProperties properties) {
        return new AdditiveRegressionForecastEngine(properties.getForecast().getIntervalWidth());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService forecastExecutor(ForecastMcpProperties properties) {
        return Executors.newFixedThreadPool(properties.getForecast().getWorkerThreads(),
                new CustomizableThreadFactory("forecast-worker-"));
    }
}
