package com.forecastplatform.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastRunnerApplication.class, args);
    }
}
