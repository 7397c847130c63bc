package com.forecastplatform.reasoning.ensemble;

import com.forecastplatform.common.config.AggregationMethod;
import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.model.DateRange;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.model.TokenVocabulary;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EnsembleReasonerTest {

    private static final PromptTemplate BASE = new PromptTemplate("base_reasoning_test",
        "Q: {question}\nWindow: {date_begin} to {date_end}\n{retrieved_info}");
    private static final PromptTemplate META = new PromptTemplate("meta_reasoning_test",
        "Q: {question}\n{base_reasonings}");
    private static final String DIGEST = "---\nARTICLES\n[1] Rates hold (published on 2024-02-01)\nSummary: s\n----";

    private static final ForecastQuestion QUESTION = ForecastQuestion.of(
        "Will the central bank cut rates by June?", "Inflation has eased.", "Resolves YES on a cut.",
        DateRange.of("2024-01-01", "2024-03-01"), LocalDate.of(2024, 6, 30));

    /** Answers with the fixed response configured for each model. */
    private static CompletionClient byModel(Map<String, String> responses, AtomicInteger calls) {
        return request -> {
            calls.incrementAndGet();
            return Mono.just(responses.get(request.model()));
        };
    }

    private static ReasoningConfig.Builder twoModels() {
        return ReasoningConfig.builder()
            .baseModels(List.of("gpt-4", "claude-2.1"))
            .baseTemplates(List.of(List.of(BASE), List.of(BASE)));
    }

    @Nested
    @DisplayName("pure aggregation")
    class PureAggregationTests {

        @Test
        @DisplayName("mean of 0.3 and 0.7 → 0.5 with no meta fields")
        void meanEndToEnd() {
            AtomicInteger calls = new AtomicInteger();
            CompletionClient client = byModel(Map.of(
                "gpt-4", "Reasoning...\n*0.3*",
                "claude-2.1", "Reasoning...\n*0.7*"), calls);

            StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, twoModels().build()))
                .assertNext(result -> {
                    assertEquals(0.5, result.metaPrediction().probability(), 1e-9);
                    assertNull(result.metaPrompt());
                    assertNull(result.metaReasoning());
                    assertEquals(List.of(List.of(Prediction.ofProbability(0.3)), List.of(Prediction.ofProbability(0.7))),
                        result.basePredictions());
                })
                .verifyComplete();
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("base prompts carry the forecast window and the digest")
        void promptContents() {
            CompletionClient client = request -> Mono.just("*0.4*");

            StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, twoModels().build()))
                .assertNext(result -> {
                    String prompt = result.baseReasonings().get(0).get(0).prompt();
                    assertTrue(prompt.contains("Window: 2024-03-01 to 2024-06-30"));
                    assertTrue(prompt.contains("[1] Rates hold"));
                    assertEquals("base_reasoning_test", result.baseReasonings().get(0).get(0).templateId());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("grouping follows configuration order, not completion order")
        void groupingOrder() {
            CompletionClient client = request -> request.model().equals("gpt-4")
                ? Mono.just("*0.1*").delayElement(Duration.ofMillis(80))
                : Mono.just("*0.9*");

            StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST,
                    twoModels().aggregationMethod(AggregationMethod.VOTE_OR_MEDIAN).build()))
                .assertNext(result -> {
                    assertEquals("gpt-4", result.baseReasonings().get(0).get(0).modelName());
                    assertEquals("claude-2.1", result.baseReasonings().get(1).get(0).modelName());
                    assertEquals(0.5, result.metaPrediction().probability(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("token answers are voted")
        void tokenVote() {
            AtomicInteger calls = new AtomicInteger();
            CompletionClient client = byModel(Map.of(
                "gpt-4", "Overall this seems Likely",
                "claude-2.1", "My answer: Likely",
                "gemini-pro", "I would say Very Unlikely"), calls);
            ReasoningConfig config = ReasoningConfig.builder()
                .baseModels(List.of("gpt-4", "claude-2.1", "gemini-pro"))
                .baseTemplates(List.of(List.of(BASE), List.of(BASE), List.of(BASE)))
                .answerType(AnswerType.TOKENS)
                .vocabulary(TokenVocabulary.SIX_OPTIONS)
                .aggregationMethod(AggregationMethod.VOTE_OR_MEDIAN)
                .build();

            StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, config))
                .assertNext(result -> assertEquals("Likely", result.metaPrediction().token()))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("single reasoning is returned directly")
    void singleReasoning() {
        AtomicInteger calls = new AtomicInteger();
        CompletionClient client = byModel(Map.of("gpt-4", "*0.81*"), calls);
        ReasoningConfig config = ReasoningConfig.builder()
            .baseModels(List.of("gpt-4"))
            .baseTemplates(List.of(List.of(BASE)))
            .aggregationMethod(AggregationMethod.META)
            .metaModel("gpt-4")
            .metaTemplate(META)
            .build();

        StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, config))
            .assertNext(result -> {
                assertEquals(0.81, result.metaPrediction().probability(), 1e-9);
                assertNull(result.metaPrompt());
                assertEquals(1, result.reasoningCount());
            })
            .verifyComplete();
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("meta aggregation sends every reasoning to the meta model")
    void metaAggregation() {
        AtomicInteger calls = new AtomicInteger();
        CompletionClient client = request -> {
            calls.incrementAndGet();
            if (request.prompt().contains("Response from forecaster")) return Mono.just("Weighing both: *0.66*");
            return Mono.just(request.model().equals("gpt-4") ? "first view *0.5*" : "second view *0.8*");
        };
        ReasoningConfig config = twoModels()
            .aggregationMethod(AggregationMethod.META)
            .metaModel("gpt-4-1106-preview")
            .metaTemplate(META)
            .build();

        StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, config))
            .assertNext(result -> {
                assertEquals(0.66, result.metaPrediction().probability(), 1e-9);
                assertTrue(result.metaPrompt().contains("Response from forecaster 1:\nfirst view *0.5*"));
                assertTrue(result.metaPrompt().contains("Response from forecaster 2:\nsecond view *0.8*"));
                assertEquals("Weighing both: *0.66*", result.metaReasoning());
            })
            .verifyComplete();
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("weight count mismatch fails before any model call")
    void weightMismatch() {
        AtomicInteger calls = new AtomicInteger();
        CompletionClient client = byModel(Map.of("gpt-4", "*0.2*", "claude-2.1", "*0.4*"), calls);
        ReasoningConfig config = twoModels()
            .aggregationMethod(AggregationMethod.WEIGHTED_MEAN)
            .weights(List.of(1.0))
            .build();

        StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, config))
            .expectError(ConfigurationException.class)
            .verify();
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("failing base call fails the question")
    void baseFailurePropagates() {
        CompletionClient client = request -> request.model().equals("claude-2.1")
            ? Mono.error(new IllegalStateException("overloaded"))
            : Mono.just("*0.4*");

        StepVerifier.create(new EnsembleReasoner(client).reason(QUESTION, DIGEST, twoModels().build()))
            .expectErrorMessage("overloaded")
            .verify();
    }
}
