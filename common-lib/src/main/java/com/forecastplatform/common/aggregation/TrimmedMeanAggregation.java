package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.model.Prediction;

import java.util.List;

/**
 * Mean that halves the influence of the outlier.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Find the prediction(s) furthest from the median.</li>
 *   <li>Those get weight 0.5; every other prediction gets {@code 1 + 0.5 / (n - 1)}.</li>
 *   <li>Return the weighted average.</li>
 * </ol>
 * Fewer than three predictions fall back to the plain mean.
 */
public class TrimmedMeanAggregation implements AggregationStrategy {

    private static final double OUTLIER_WEIGHT = 0.5;

    @Override
    public Prediction aggregate(List<List<Prediction>> groupedPredictions) {
        List<Prediction> flat = Predictions.flatten(groupedPredictions);
        Predictions.requireProbabilities(flat, "trimmed-mean");
        List<Double> values = flat.stream().map(Prediction::probability).toList();
        int n = values.size();
        if (n < 3) {
            return Prediction.ofProbability(values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN));
        }

        double median = Predictions.median(values);
        double maxDistance = values.stream().mapToDouble(v -> Math.abs(v - median)).max().orElse(0.0);
        double otherWeight = 1.0 + OUTLIER_WEIGHT / (n - 1);

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (double v : values) {
            double w = Math.abs(v - median) == maxDistance ? OUTLIER_WEIGHT : otherWeight;
            weightedSum += v * w;
            totalWeight += w;
        }
        return Prediction.ofProbability(weightedSum / totalWeight);
    }
}
