package com.forecastplatform.common.model;

import java.util.List;

/**
 * Final output of the ensemble reasoner for one question.
 *
 * <p>{@code baseReasonings} is grouped per model, in configuration order. {@code metaPrompt}
 * and {@code metaReasoning} are {@code null} unless the meta-aggregation path was taken.
 */
public record EnsembleResult(
    List<List<BaseReasoning>> baseReasonings,
    Prediction metaPrediction,
    String metaPrompt,
    String metaReasoning
) {

    public EnsembleResult {
        baseReasonings = baseReasonings.stream().map(List::copyOf).toList();
    }

    public static EnsembleResult withoutMeta(List<List<BaseReasoning>> baseReasonings, Prediction prediction) {
        return new EnsembleResult(baseReasonings, prediction, null, null);
    }

    /** Base predictions with the same per-model grouping as {@link #baseReasonings()}. */
    public List<List<Prediction>> basePredictions() {
        return baseReasonings.stream()
            .map(group -> group.stream().map(BaseReasoning::prediction).toList())
            .toList();
    }

    public int reasoningCount() {
        return baseReasonings.stream().mapToInt(List::size).sum();
    }
}
