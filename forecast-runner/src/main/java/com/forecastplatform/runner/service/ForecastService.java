package com.forecastplatform.runner.service;

import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.EnsembleResult;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.trace.QuestionTrace;
import com.forecastplatform.reasoning.alignment.AlignmentScorer;
import com.forecastplatform.reasoning.ensemble.EnsembleReasoner;
import com.forecastplatform.retrieval.RetrievalOutcome;
import com.forecastplatform.retrieval.RetrievalPipeline;
import com.forecastplatform.runner.logger.ForecastFlowLogger;
import com.forecastplatform.runner.model.ForecastRecord;
import com.forecastplatform.runner.store.ResultKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Forecasts one question end to end: retrieval pass, ensemble reasoning, optional
 * alignment scoring, record assembly. Nothing here is persisted.
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final RetrievalPipeline retrievalPipeline;
    private final EnsembleReasoner ensembleReasoner;
    private final AlignmentScorer alignmentScorer;
    private final RetrievalConfig retrievalConfig;
    private final ReasoningConfig reasoningConfig;
    private final ForecastFlowLogger flowLogger;
    private final boolean alignmentEnabled;
    private final Clock clock;

    @Autowired
    public ForecastService(RetrievalPipeline retrievalPipeline,
                           EnsembleReasoner ensembleReasoner,
                           AlignmentScorer alignmentScorer,
                           RetrievalConfig retrievalConfig,
                           ReasoningConfig reasoningConfig,
                           ForecastFlowLogger flowLogger,
                           @Value("${forecast.reasoning.alignment-enabled:false}") boolean alignmentEnabled) {
        this(retrievalPipeline, ensembleReasoner, alignmentScorer, retrievalConfig, reasoningConfig,
            flowLogger, alignmentEnabled, Clock.systemUTC());
    }

    ForecastService(RetrievalPipeline retrievalPipeline,
                    EnsembleReasoner ensembleReasoner,
                    AlignmentScorer alignmentScorer,
                    RetrievalConfig retrievalConfig,
                    ReasoningConfig reasoningConfig,
                    ForecastFlowLogger flowLogger,
                    boolean alignmentEnabled,
                    Clock clock) {
        this.retrievalPipeline = retrievalPipeline;
        this.ensembleReasoner  = ensembleReasoner;
        this.alignmentScorer   = alignmentScorer;
        this.retrievalConfig   = retrievalConfig;
        this.reasoningConfig   = reasoningConfig;
        this.flowLogger        = flowLogger;
        this.alignmentEnabled  = alignmentEnabled && reasoningConfig.alignmentTemplate() != null;
        this.clock             = clock;
    }

    public Mono<ForecastRecord> forecast(ForecastQuestion question, int retrievalIndex) {
        String questionId = ResultKey.slug(question.question());
        Mono<ForecastRecord> pipeline = Mono.defer(() -> {
            log.info("[Forecast] Forecast started. retrievalIndex={} question={}", retrievalIndex, question.question());
            return retrievalPipeline.run(question, retrievalConfig)
                .doOnNext(outcome -> flowLogger.logRetrieval(outcome, questionId))
                .flatMap(outcome -> ensembleReasoner.reason(question, outcome.digest(), reasoningConfig)
                    .doOnNext(result -> flowLogger.logEnsemble(result, questionId))
                    .flatMap(result -> alignment(result, question)
                        .map(scores -> assemble(question, retrievalIndex, outcome, result, scores))));
        });
        return QuestionTrace.withQuestionId(pipeline, questionId);
    }

    private Mono<List<List<Double>>> alignment(EnsembleResult result, ForecastQuestion question) {
        if (!alignmentEnabled) return Mono.just(List.of());
        return alignmentScorer.score(result.baseReasonings(), question, reasoningConfig);
    }

    private ForecastRecord assemble(ForecastQuestion question, int retrievalIndex, RetrievalOutcome outcome,
                                    EnsembleResult result, List<List<Double>> alignmentScores) {
        ForecastRecord record = ForecastRecord.assemble(question, retrievalIndex, outcome, result,
            alignmentScores, reasoningConfig.vocabulary(), Instant.now(clock));
        log.info("[Forecast] Forecast complete. finalProbability={} metaBrier={} communityBrier={}",
            record.finalProbability(), record.metaBrierScore(), record.communityBrierScore());
        return record;
    }
}
