package com.forecastplatform.reasoning.alignment;

import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.model.BaseReasoning;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.parse.ResponseParser;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rates, on the 1-6 scale, how well each base reasoning supports its own prediction.
 *
 * <p>Output keeps the per-model grouping of the input. A reasoning whose scoring call fails
 * is logged and left out of its group.
 */
public class AlignmentScorer {

    private static final Logger log = LoggerFactory.getLogger(AlignmentScorer.class);

    static final int MAX_RESPONSE_TOKENS = 2000;

    private final CompletionClient completionClient;

    public AlignmentScorer(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public Mono<List<List<Double>>> score(List<List<BaseReasoning>> grouped, ForecastQuestion question,
                                          ReasoningConfig config) {
        return Flux.fromIterable(grouped)
            .concatMap(group -> Flux.fromIterable(group)
                .flatMapSequential(reasoning -> scoreOne(reasoning, question, config), Math.max(1, config.concurrency()))
                .collectList())
            .collectList();
    }

    private Mono<Double> scoreOne(BaseReasoning reasoning, ForecastQuestion question, ReasoningConfig config) {
        Map<String, Object> values = new HashMap<>();
        values.put(PromptTemplate.QUESTION, question.question());
        values.put(PromptTemplate.BACKGROUND, question.background() == null ? "" : question.background());
        values.put(PromptTemplate.RESOLUTION_CRITERIA,
            question.resolutionCriteria() == null ? "" : question.resolutionCriteria());
        values.put(PromptTemplate.REASONING, reasoning.reasoning());
        String prompt = config.alignmentTemplate().render(values);

        return completionClient.complete(CompletionRequest.of(config.alignmentModel(), prompt, config.alignmentTemperature())
                .withMaxTokens(MAX_RESPONSE_TOKENS))
            .map(ResponseParser::extractRating)
            .onErrorResume(e -> {
                log.error("[Alignment] Scoring failed, skipping reasoning. model={} template={} reason={}",
                    reasoning.modelName(), reasoning.templateId(), e.getMessage());
                return Mono.empty();
            });
    }
}
