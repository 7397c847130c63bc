package com.forecastplatform.common.exception;

/**
 * Invalid or inconsistent configuration detected before any provider call is made.
 * Never retried.
 */
public class ConfigurationException extends ForecastException {

    public ConfigurationException(String message) {
        super("config", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("config", message, cause);
    }
}
