package com.example.forecastmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastMcpApplication.class, args);
    }
}
