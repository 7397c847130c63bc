package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.Prediction;

import java.util.List;

/** Arithmetic mean of every base probability, all forecasters weighted equally. */
public class MeanAggregation implements AggregationStrategy {

    @Override
    public Prediction aggregate(List<List<Prediction>> groupedPredictions) {
        List<Prediction> flat = Predictions.flatten(groupedPredictions);
        Predictions.requireProbabilities(flat, "mean");
        if (flat.isEmpty()) throw new ConfigurationException("mean aggregation needs at least one prediction");
        double sum = 0.0;
        for (Prediction p : flat) sum += p.probability();
        return Prediction.ofProbability(sum / flat.size());
    }
}
