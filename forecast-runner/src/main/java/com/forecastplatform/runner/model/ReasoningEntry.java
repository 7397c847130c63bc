package com.forecastplatform.runner.model;

import com.forecastplatform.common.model.BaseReasoning;
import com.forecastplatform.common.model.Prediction;

/**
 * Stored form of one base reasoning. Exactly one of {@code probability} / {@code token} is set.
 */
public record ReasoningEntry(
    String modelName,
    String templateId,
    String prompt,
    String reasoning,
    Double probability,
    String token
) {

    public static ReasoningEntry from(BaseReasoning reasoning) {
        Prediction prediction = reasoning.prediction();
        return new ReasoningEntry(reasoning.modelName(), reasoning.templateId(), reasoning.prompt(),
            reasoning.reasoning(),
            prediction.isProbability() ? prediction.probability() : null,
            prediction.isProbability() ? null : prediction.token());
    }
}
