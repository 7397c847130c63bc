package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.Arrays;

/** How much of each article is shown to the rating model. */
public enum RatingDetail {
    TITLE("title"),
    TITLE_EXCERPT("title_250_tokens"),
    FULL_TEXT("full-text");

    private final String value;

    RatingDetail(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RatingDetail fromValue(String value) {
        return Arrays.stream(values())
            .filter(d -> d.value.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown rating detail level: " + value));
    }
}
