package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.model.Prediction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Median for probability answers, plurality vote for token answers.
 * Vote ties go to the token seen first.
 */
public class VoteOrMedianAggregation implements AggregationStrategy {

    @Override
    public Prediction aggregate(List<List<Prediction>> groupedPredictions) {
        List<Prediction> flat = Predictions.flatten(groupedPredictions);
        if (flat.stream().allMatch(Prediction::isProbability)) {
            return Prediction.ofProbability(Predictions.median(
                flat.stream().map(Prediction::probability).toList()));
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Prediction p : flat) {
            if (p.token() != null) counts.merge(p.token(), 1, Integer::sum);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                winner = e.getKey();
            }
        }
        return Prediction.ofToken(winner);
    }
}
