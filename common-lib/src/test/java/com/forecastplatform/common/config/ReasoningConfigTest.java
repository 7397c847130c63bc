package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.prompt.PromptTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningConfigTest {

    private static final PromptTemplate BASE = new PromptTemplate("base", "{question}");

    private static ReasoningConfig.Builder twoModels() {
        return ReasoningConfig.builder()
            .baseModels(List.of("gpt-4", "claude-2.1"))
            .baseTemplates(List.of(List.of(BASE), List.of(BASE, BASE)));
    }

    @Test
    @DisplayName("valid configuration passes and counts reasonings")
    void valid() {
        ReasoningConfig config = twoModels().build().validate();
        assertEquals(3, config.reasoningCount());
    }

    @Test
    @DisplayName("template lists must match models")
    void templateCountMismatch() {
        ReasoningConfig config = twoModels().baseTemplates(List.of(List.of(BASE))).build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    @DisplayName("weighted-mean needs one weight per model")
    void weightMismatch() {
        ReasoningConfig config = twoModels()
            .aggregationMethod(AggregationMethod.WEIGHTED_MEAN)
            .weights(List.of(1.0))
            .build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    @DisplayName("mean over tokens is rejected")
    void meanOverTokens() {
        ReasoningConfig config = twoModels().answerType(AnswerType.TOKENS).build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    @DisplayName("meta needs a meta model")
    void metaNeedsModel() {
        ReasoningConfig config = twoModels().aggregationMethod(AggregationMethod.META).build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    @DisplayName("unknown aggregation name → ConfigurationException")
    void unknownAggregation() {
        assertThrows(ConfigurationException.class, () -> AggregationMethod.fromValue("geometric"));
        assertEquals(AggregationMethod.VOTE_OR_MEDIAN, AggregationMethod.fromValue("vote-or-median"));
    }
}
