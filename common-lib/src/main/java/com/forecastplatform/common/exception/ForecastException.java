package com.forecastplatform.common.exception;

/**
 * Unchecked failure raised by a pipeline stage. The message is prefixed with the
 * stage name so the per-question batch boundary can log it without extra context.
 */
public class ForecastException extends RuntimeException {
    private final String stage;

    public ForecastException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public ForecastException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
