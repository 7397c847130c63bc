package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.model.TokenVocabulary;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.util.List;

/**
 * Immutable settings for the ensemble reasoner and the alignment scorer.
 *
 * <p>{@code baseTemplates.get(i)} lists the prompt templates run against {@code baseModels.get(i)}.
 * {@code weights}, when present, holds one weight per model and is only read by
 * {@link AggregationMethod#WEIGHTED_MEAN}.
 */
public record ReasoningConfig(
    List<String> baseModels,
    List<List<PromptTemplate>> baseTemplates,
    double baseTemperature,
    AnswerType answerType,
    TokenVocabulary vocabulary,
    AggregationMethod aggregationMethod,
    List<Double> weights,
    String metaModel,
    PromptTemplate metaTemplate,
    double metaTemperature,
    String alignmentModel,
    PromptTemplate alignmentTemplate,
    double alignmentTemperature,
    int concurrency
) {

    public ReasoningConfig {
        baseModels = List.copyOf(baseModels);
        baseTemplates = baseTemplates.stream().map(List::copyOf).toList();
        weights = weights == null ? null : List.copyOf(weights);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every combination the reasoner cannot handle. Called before any model call so a
     * misconfigured ensemble never spends tokens.
     */
    public ReasoningConfig validate() {
        if (baseModels.isEmpty()) {
            throw new ConfigurationException("At least one base model is required");
        }
        if (baseModels.size() != baseTemplates.size()) {
            throw new ConfigurationException("Expected one template list per base model: models="
                + baseModels.size() + " templateLists=" + baseTemplates.size());
        }
        if (baseTemplates.stream().anyMatch(List::isEmpty)) {
            throw new ConfigurationException("Every base model needs at least one prompt template");
        }
        if (aggregationMethod == null) {
            throw new ConfigurationException("Aggregation method is required");
        }
        if (answerType == AnswerType.TOKENS) {
            if (vocabulary == null) {
                throw new ConfigurationException("Token answers need a vocabulary");
            }
            if (aggregationMethod == AggregationMethod.MEAN
                || aggregationMethod == AggregationMethod.WEIGHTED_MEAN
                || aggregationMethod == AggregationMethod.TRIMMED_MEAN) {
                throw new ConfigurationException(
                    "Aggregation " + aggregationMethod.value() + " is not defined for token answers");
            }
        }
        if (aggregationMethod == AggregationMethod.WEIGHTED_MEAN) {
            if (weights == null || weights.size() != baseModels.size()) {
                throw new ConfigurationException("weighted-mean needs one weight per base model: models="
                    + baseModels.size() + " weights=" + (weights == null ? 0 : weights.size()));
            }
        }
        if (aggregationMethod == AggregationMethod.META && (metaModel == null || metaTemplate == null)) {
            throw new ConfigurationException("Meta aggregation needs a meta model and template");
        }
        return this;
    }

    public int reasoningCount() {
        return baseTemplates.stream().mapToInt(List::size).sum();
    }

    public static final class Builder {
        private List<String> baseModels = List.of();
        private List<List<PromptTemplate>> baseTemplates = List.of();
        private double baseTemperature = 0.0;
        private AnswerType answerType = AnswerType.PROBABILITY;
        private TokenVocabulary vocabulary = TokenVocabulary.TEN_OPTIONS;
        private AggregationMethod aggregationMethod = AggregationMethod.MEAN;
        private List<Double> weights;
        private String metaModel;
        private PromptTemplate metaTemplate;
        private double metaTemperature = 0.2;
        private String alignmentModel = "gpt-3.5-turbo-1106";
        private PromptTemplate alignmentTemplate;
        private double alignmentTemperature = 0.0;
        private int concurrency = 4;

        private Builder() {}

        public Builder baseModels(List<String> v) { this.baseModels = v; return this; }
        public Builder baseTemplates(List<List<PromptTemplate>> v) { this.baseTemplates = v; return this; }
        public Builder baseTemperature(double v) { this.baseTemperature = v; return this; }
        public Builder answerType(AnswerType v) { this.answerType = v; return this; }
        public Builder vocabulary(TokenVocabulary v) { this.vocabulary = v; return this; }
        public Builder aggregationMethod(AggregationMethod v) { this.aggregationMethod = v; return this; }
        public Builder weights(List<Double> v) { this.weights = v; return this; }
        public Builder metaModel(String v) { this.metaModel = v; return this; }
        public Builder metaTemplate(PromptTemplate v) { this.metaTemplate = v; return this; }
        public Builder metaTemperature(double v) { this.metaTemperature = v; return this; }
        public Builder alignmentModel(String v) { this.alignmentModel = v; return this; }
        public Builder alignmentTemplate(PromptTemplate v) { this.alignmentTemplate = v; return this; }
        public Builder alignmentTemperature(double v) { this.alignmentTemperature = v; return this; }
        public Builder concurrency(int v) { this.concurrency = v; return this; }

        public ReasoningConfig build() {
            return new ReasoningConfig(baseModels, baseTemplates, baseTemperature, answerType, vocabulary,
                aggregationMethod, weights, metaModel, metaTemplate, metaTemperature, alignmentModel,
                alignmentTemplate, alignmentTemperature, concurrency);
        }
    }
}
