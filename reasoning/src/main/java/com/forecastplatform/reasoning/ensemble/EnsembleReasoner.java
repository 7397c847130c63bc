package com.forecastplatform.reasoning.ensemble;

import com.forecastplatform.common.aggregation.AggregationStrategies;
import com.forecastplatform.common.aggregation.PredictionGuard;
import com.forecastplatform.common.config.AggregationMethod;
import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.model.BaseReasoning;
import com.forecastplatform.common.model.EnsembleResult;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.parse.ResponseParser;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Elicits one reasoning per (base model, prompt template) and combines their predictions.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>Validate the configuration. Nothing is sent if it is inconsistent.</li>
 *   <li>Run every base call concurrently; results are regrouped per model in configuration order.</li>
 *   <li>A single base reasoning is returned as the final prediction as-is.</li>
 *   <li>{@code meta} sends all reasonings to the meta model and reads its prediction;
 *       every other method applies its pure {@link com.forecastplatform.common.aggregation.AggregationStrategy}.</li>
 *   <li>The final prediction is clamped by {@link PredictionGuard}.</li>
 * </ol>
 *
 * <p>A base call that fails after the gateway's retries fails the whole question.
 */
public class EnsembleReasoner {

    private static final Logger log = LoggerFactory.getLogger(EnsembleReasoner.class);

    private final CompletionClient completionClient;

    public EnsembleReasoner(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public Mono<EnsembleResult> reason(ForecastQuestion question, String digest, ReasoningConfig config) {
        return Mono.fromCallable(config::validate)
            .flatMap(valid -> elicit(question, digest, valid))
            .flatMap(grouped -> aggregate(grouped, question, digest, config));
    }

    Mono<List<List<BaseReasoning>>> elicit(ForecastQuestion question, String digest, ReasoningConfig config) {
        Map<String, Object> values = ReasoningPrompts.values(question, digest);
        List<BaseCall> calls = new ArrayList<>();
        for (int m = 0; m < config.baseModels().size(); m++) {
            for (PromptTemplate template : config.baseTemplates().get(m)) {
                calls.add(new BaseCall(m, config.baseModels().get(m), template, template.render(values)));
            }
        }

        return Flux.fromIterable(calls)
            .flatMapSequential(call -> completionClient
                .complete(CompletionRequest.of(call.model(), call.prompt(), config.baseTemperature()))
                .map(response -> new IndexedReasoning(call.modelIndex(), new BaseReasoning(
                    call.model(), call.template().id(), call.prompt(), response,
                    ResponseParser.extractPrediction(response, config.answerType(), config.vocabulary())))),
                Math.max(1, config.concurrency()))
            .collectList()
            .map(indexed -> {
                List<List<BaseReasoning>> grouped = new ArrayList<>();
                for (int m = 0; m < config.baseModels().size(); m++) grouped.add(new ArrayList<>());
                indexed.forEach(r -> grouped.get(r.modelIndex()).add(r.reasoning()));
                log.info("[Ensemble] Base reasonings elicited. models={} reasonings={}",
                    config.baseModels(), indexed.size());
                return grouped;
            });
    }

    /**
     * Combines already-elicited reasonings. Exposed so stored reasonings can be re-aggregated
     * with a different method without repeating the base calls.
     */
    public Mono<EnsembleResult> aggregate(List<List<BaseReasoning>> grouped, ForecastQuestion question,
                                          String digest, ReasoningConfig config) {
        List<BaseReasoning> flat = new ArrayList<>();
        grouped.forEach(flat::addAll);
        if (flat.size() == 1) {
            return Mono.just(EnsembleResult.withoutMeta(grouped, flat.get(0).prediction()));
        }

        if (config.aggregationMethod() == AggregationMethod.META) {
            String metaPrompt = MetaPromptBuilder.build(config.metaTemplate(), question, digest, grouped);
            return completionClient.complete(CompletionRequest.of(config.metaModel(), metaPrompt, config.metaTemperature()))
                .map(response -> {
                    Prediction meta = PredictionGuard.clamp(
                        ResponseParser.extractPrediction(response, config.answerType(), config.vocabulary()),
                        config.vocabulary());
                    log.info("[Ensemble] Meta prediction aggregated. model={} prediction={}", config.metaModel(), meta);
                    return new EnsembleResult(grouped, meta, metaPrompt, response);
                });
        }

        return Mono.fromCallable(() -> {
            List<List<Prediction>> predictions = grouped.stream()
                .map(group -> group.stream().map(BaseReasoning::prediction).toList())
                .toList();
            Prediction combined = PredictionGuard.clamp(
                AggregationStrategies.forMethod(config.aggregationMethod(), config.weights()).aggregate(predictions),
                config.vocabulary());
            log.info("[Ensemble] Predictions aggregated. method={} count={} prediction={}",
                config.aggregationMethod().value(), flat.size(), combined);
            return EnsembleResult.withoutMeta(grouped, combined);
        });
    }

    private record BaseCall(int modelIndex, String model, PromptTemplate template, String prompt) {}

    private record IndexedReasoning(int modelIndex, BaseReasoning reasoning) {}
}
