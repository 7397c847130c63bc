package com.forecastplatform.reasoning.alignment;

import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.model.BaseReasoning;
import com.forecastplatform.common.model.DateRange;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlignmentScorerTest {

    private static final ForecastQuestion QUESTION = ForecastQuestion.of("Will it happen?", "bg", "criteria",
        DateRange.of("2024-01-01", "2024-02-01"), LocalDate.of(2024, 5, 1));

    private static final ReasoningConfig CONFIG = ReasoningConfig.builder()
        .alignmentTemplate(new PromptTemplate("alignment_test", "Q: {question}\nReasoning: {reasoning}"))
        .build();

    private static BaseReasoning reasoning(String model, String text) {
        return new BaseReasoning(model, "t", "prompt", text, Prediction.ofProbability(0.5));
    }

    @Test
    @DisplayName("scores keep per-model grouping; failures are left out")
    void scoresAndSkips() {
        CompletionClient client = request -> {
            if (request.prompt().contains("broken")) return Mono.error(new IllegalStateException("HTTP 503"));
            if (request.prompt().contains("strong")) return Mono.just("Thoughts: consistent.\nRating: 6");
            return Mono.just("Rating: 3");
        };
        List<List<BaseReasoning>> grouped = List.of(
            List.of(reasoning("gpt-4", "strong argument"), reasoning("gpt-4", "broken argument")),
            List.of(reasoning("claude-2.1", "weak argument")));

        StepVerifier.create(new AlignmentScorer(client).score(grouped, QUESTION, CONFIG))
            .assertNext(scores -> assertEquals(List.of(List.of(6.0), List.of(3.0)), scores))
            .verifyComplete();
    }

    @Test
    @DisplayName("responses are capped at 2000 tokens")
    void maxTokens() {
        CompletionClient client = request -> Mono.just(String.valueOf(request.maxTokens() == 2000 ? 5 : 1));

        StepVerifier.create(new AlignmentScorer(client).score(
                List.of(List.of(reasoning("gpt-4", "x"))), QUESTION, CONFIG))
            .assertNext(scores -> assertEquals(5.0, scores.get(0).get(0), 1e-9))
            .verifyComplete();
    }
}
