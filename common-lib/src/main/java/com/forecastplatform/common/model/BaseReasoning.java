package com.forecastplatform.common.model;

/**
 * Output of one (model, prompt template) forecaster call.
 *
 * @param modelName  model that produced the reasoning
 * @param templateId prompt template used
 * @param prompt     fully rendered prompt text
 * @param reasoning  raw model response
 * @param prediction prediction extracted from {@code reasoning}
 */
public record BaseReasoning(
    String modelName,
    String templateId,
    String prompt,
    String reasoning,
    Prediction prediction
) {}
