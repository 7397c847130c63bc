package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.model.Prediction;

import java.util.List;

/**
 * Strategy contract for combining base predictions into one ensemble prediction.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no model calls</li>
 * </ul>
 *
 * <p>Predictions arrive grouped per base model, in configuration order. Implementations may
 * return out-of-range values; {@link PredictionGuard} clamps them afterwards. Meta
 * aggregation needs a model call and therefore lives in the reasoner, not here.
 */
public interface AggregationStrategy {

    /**
     * @param groupedPredictions non-empty predictions, one inner list per base model
     * @return combined prediction, never {@code null}
     */
    Prediction aggregate(List<List<Prediction>> groupedPredictions);
}
