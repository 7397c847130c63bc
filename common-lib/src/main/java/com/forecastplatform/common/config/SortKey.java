package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.Arrays;

/** Ordering applied to ranked articles, always descending. */
public enum SortKey {
    DATE("date"),
    RELEVANCE("relevance");

    private final String value;

    SortKey(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SortKey fromValue(String value) {
        return Arrays.stream(values())
            .filter(k -> k.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Invalid sort key: " + value));
    }
}
