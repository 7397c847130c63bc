package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.Prediction;

import java.util.ArrayList;
import java.util.List;

final class Predictions {

    private Predictions() {}

    static List<Prediction> flatten(List<List<Prediction>> grouped) {
        List<Prediction> flat = new ArrayList<>();
        for (List<Prediction> group : grouped) flat.addAll(group);
        return flat;
    }

    static void requireProbabilities(List<Prediction> predictions, String method) {
        if (predictions.stream().anyMatch(p -> !p.isProbability())) {
            throw new ConfigurationException("Aggregation " + method + " is not defined for token answers");
        }
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int n = sorted.size();
        if (n % 2 == 1) return sorted.get(n / 2);
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
