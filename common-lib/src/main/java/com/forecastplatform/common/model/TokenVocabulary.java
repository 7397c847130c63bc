package com.forecastplatform.common.model;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of likelihood phrases a forecaster may answer with, each mapped to the
 * probability it stands for. {@code defaultToken} is used when no phrase can be read.
 */
public record TokenVocabulary(Map<String, Double> probabilities, String defaultToken) {

    public static final TokenVocabulary SIX_OPTIONS = of("Unlikely",
        "No", 0.05,
        "Very Unlikely", 0.15,
        "Unlikely", 0.35,
        "Likely", 0.55,
        "Very Likely", 0.75,
        "Yes", 0.95);

    public static final TokenVocabulary TEN_OPTIONS = of("Slightly Unlikely",
        "No", 0.05,
        "Extremely Unlikely", 0.15,
        "Very Unlikely", 0.25,
        "Unlikely", 0.35,
        "Slightly Unlikely", 0.45,
        "Slightly Likely", 0.55,
        "Likely", 0.65,
        "Very Likely", 0.75,
        "Extremely Likely", 0.85,
        "Yes", 0.95);

    public TokenVocabulary {
        probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
        if (!probabilities.containsKey(defaultToken)) {
            throw new IllegalArgumentException("Default token '" + defaultToken + "' is not in the vocabulary");
        }
    }

    private static TokenVocabulary of(String defaultToken, Object... tokenProbabilityPairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < tokenProbabilityPairs.length; i += 2) {
            map.put((String) tokenProbabilityPairs[i], (Double) tokenProbabilityPairs[i + 1]);
        }
        return new TokenVocabulary(map, defaultToken);
    }

    public static TokenVocabulary named(String name) {
        if ("six".equalsIgnoreCase(name)) return SIX_OPTIONS;
        if ("ten".equalsIgnoreCase(name)) return TEN_OPTIONS;
        throw new ConfigurationException("Unknown token vocabulary: " + name);
    }

    public List<String> tokens() {
        return List.copyOf(probabilities.keySet());
    }

    public boolean contains(String token) {
        return token != null && probabilities.containsKey(token);
    }

    public double probabilityOf(String token) {
        return probabilities.getOrDefault(token, probabilities.get(defaultToken));
    }
}
