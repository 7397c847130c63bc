package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.Arrays;

public enum RankingMethod {
    /** A completion model rates each article on a 1-6 scale. */
    MODEL_RATING("llm-rating"),
    /** Cosine similarity between question and article embeddings. */
    EMBEDDING("embedding");

    private final String value;

    RankingMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RankingMethod fromValue(String value) {
        return Arrays.stream(values())
            .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown ranking method: " + value));
    }
}
