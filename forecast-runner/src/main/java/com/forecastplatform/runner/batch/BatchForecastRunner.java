package com.forecastplatform.runner.batch;

import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.trace.QuestionTrace;
import com.forecastplatform.runner.batch.BatchReport.QuestionOutcome;
import com.forecastplatform.runner.batch.BatchReport.Status;
import com.forecastplatform.runner.logger.ForecastFlowLogger;
import com.forecastplatform.runner.service.ForecastService;
import com.forecastplatform.runner.store.ResultKey;
import com.forecastplatform.runner.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Forecasts a list of questions one after another and stores each result.
 *
 * <h3>Per question</h3>
 * <ol>
 *   <li>Skip when a record already exists under the question's {@link ResultKey}.</li>
 *   <li>Run {@link ForecastService#forecast} and save the record.</li>
 *   <li>Any failure is logged and counted; the batch moves on to the next question.</li>
 * </ol>
 */
@Component
public class BatchForecastRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchForecastRunner.class);

    private final ForecastService forecastService;
    private final ResultStore resultStore;
    private final ForecastFlowLogger flowLogger;
    private final String outputDir;

    public BatchForecastRunner(ForecastService forecastService,
                               ResultStore resultStore,
                               ForecastFlowLogger flowLogger,
                               @Value("${forecast.output-dir:results}") String outputDir) {
        this.forecastService = forecastService;
        this.resultStore     = resultStore;
        this.flowLogger      = flowLogger;
        this.outputDir       = outputDir;
    }

    public Mono<BatchReport> run(List<ForecastQuestion> questions, int retrievalIndex) {
        log.info("[Batch] Batch started. questions={} retrievalIndex={} outputDir={}",
            questions.size(), retrievalIndex, outputDir);
        return Flux.fromIterable(questions)
            .concatMap(question -> forecastOne(question, retrievalIndex))
            .reduce(BatchReport.empty(), BatchReport::add)
            .doOnNext(report -> log.info("[Batch] Batch finished. succeeded={} skipped={} failed={}",
                report.succeeded(), report.skipped(), report.failed()));
    }

    private Mono<QuestionOutcome> forecastOne(ForecastQuestion question, int retrievalIndex) {
        ResultKey key = ResultKey.of(outputDir, retrievalIndex, question.question());
        Mono<QuestionOutcome> outcome = Mono.fromCallable(() -> resultStore.exists(key))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(exists -> {
                if (exists) {
                    log.info("[Batch] Result exists, skipping. key={}", key);
                    return Mono.just(new QuestionOutcome(question.question(), Status.SKIPPED));
                }
                return forecastService.forecast(question, retrievalIndex)
                    .flatMap(record -> Mono.fromRunnable(() -> resultStore.save(key, record))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenReturn(new QuestionOutcome(question.question(), Status.SUCCEEDED)))
                    .doOnEach(flowLogger.stage(ForecastFlowLogger.RESULT_STORED));
            })
            .onErrorResume(e -> {
                String stage = e instanceof ForecastException fe ? fe.getStage() : "unknown";
                log.error("[Batch] Question failed. question={} stage={} reason={}",
                    question.question(), stage, e.getMessage(), e);
                return Mono.just(new QuestionOutcome(question.question(), Status.FAILED));
            });
        return QuestionTrace.withQuestionId(outcome, key.questionSlug());
    }
}
