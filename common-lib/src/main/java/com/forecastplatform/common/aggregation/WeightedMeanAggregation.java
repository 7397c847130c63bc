package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.Prediction;

import java.util.List;

/**
 * Weighted mean with one weight per base model.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Every prediction in group {@code i} carries weight {@code weights[i]}.</li>
 *   <li>{@code result = Σ(p × w) / Σ(w)}.</li>
 * </ol>
 * A weight list whose length differs from the number of groups is a configuration error.
 */
public class WeightedMeanAggregation implements AggregationStrategy {

    private final List<Double> weights;

    public WeightedMeanAggregation(List<Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new ConfigurationException("weighted-mean needs at least one weight");
        }
        this.weights = List.copyOf(weights);
    }

    @Override
    public Prediction aggregate(List<List<Prediction>> groupedPredictions) {
        if (groupedPredictions.size() != weights.size()) {
            throw new ConfigurationException("weighted-mean weight count " + weights.size()
                + " does not match model group count " + groupedPredictions.size());
        }
        Predictions.requireProbabilities(Predictions.flatten(groupedPredictions), "weighted-mean");

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < groupedPredictions.size(); i++) {
            double w = weights.get(i);
            for (Prediction p : groupedPredictions.get(i)) {
                weightedSum += p.probability() * w;
                totalWeight += w;
            }
        }
        return Prediction.ofProbability(totalWeight > 0.0 ? weightedSum / totalWeight : Double.NaN);
    }
}
