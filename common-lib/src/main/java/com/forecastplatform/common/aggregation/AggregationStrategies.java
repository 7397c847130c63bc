package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.config.AggregationMethod;
import com.forecastplatform.common.exception.ConfigurationException;

import java.util.List;

/** Resolves an {@link AggregationMethod} to its strategy. */
public final class AggregationStrategies {

    private AggregationStrategies() {}

    /**
     * @param weights per-model weights, read only for {@link AggregationMethod#WEIGHTED_MEAN}
     * @throws ConfigurationException for {@link AggregationMethod#META}, which needs a model call
     */
    public static AggregationStrategy forMethod(AggregationMethod method, List<Double> weights) {
        switch (method) {
            case MEAN:
                return new MeanAggregation();
            case WEIGHTED_MEAN:
                return new WeightedMeanAggregation(weights);
            case VOTE_OR_MEDIAN:
                return new VoteOrMedianAggregation();
            case TRIMMED_MEAN:
                return new TrimmedMeanAggregation();
            default:
                throw new ConfigurationException("Aggregation " + method.value() + " has no pure strategy");
        }
    }
}
