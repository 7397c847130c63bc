package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.Arrays;

/** How base predictions are combined into the ensemble's final prediction. */
public enum AggregationMethod {
    MEAN("mean"),
    WEIGHTED_MEAN("weighted-mean"),
    VOTE_OR_MEDIAN("vote-or-median"),
    TRIMMED_MEAN("trimmed-mean"),
    META("meta");

    private final String value;

    AggregationMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AggregationMethod fromValue(String value) {
        return Arrays.stream(values())
            .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown aggregation method: " + value));
    }
}
