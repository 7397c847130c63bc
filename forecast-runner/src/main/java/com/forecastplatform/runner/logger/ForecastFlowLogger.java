package com.forecastplatform.runner.logger;

import com.forecastplatform.common.model.EnsembleResult;
import com.forecastplatform.common.trace.QuestionTrace;
import com.forecastplatform.retrieval.RetrievalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage a question passes through. Pure side effects; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #QUERIES_PLANNED}</li>
 *   <li>{@link #ARTICLES_RETRIEVED}</li>
 *   <li>{@link #ARTICLES_PREFILTERED}</li>
 *   <li>{@link #ARTICLES_RANKED}</li>
 *   <li>{@link #ARTICLES_SUMMARIZED}</li>
 *   <li>{@link #BASE_REASONINGS_ELICITED}</li>
 *   <li>{@link #ENSEMBLE_AGGREGATED}</li>
 *   <li>{@link #RESULT_STORED}</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads questionId from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(ForecastFlowLogger.ENSEMBLE_AGGREGATED))
 * </pre>
 */
@Component
public class ForecastFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ForecastFlowLogger.class);

    public static final String QUERIES_PLANNED          = "QUERIES_PLANNED";
    public static final String ARTICLES_RETRIEVED       = "ARTICLES_RETRIEVED";
    public static final String ARTICLES_PREFILTERED     = "ARTICLES_PREFILTERED";
    public static final String ARTICLES_RANKED          = "ARTICLES_RANKED";
    public static final String ARTICLES_SUMMARIZED      = "ARTICLES_SUMMARIZED";
    public static final String BASE_REASONINGS_ELICITED = "BASE_REASONINGS_ELICITED";
    public static final String ENSEMBLE_AGGREGATED      = "ENSEMBLE_AGGREGATED";
    public static final String RESULT_STORED            = "RESULT_STORED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The questionId is bridged from Context to MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String questionId = QuestionTrace.getQuestionId(signal.getContextView());
            QuestionTrace.withMdc(questionId, () ->
                log.info("[ForecastFlow] stage={} questionId={}", stageName, questionId)
            );
        };
    }

    /** One line per retrieval stage, with the article counts each stage produced. */
    public void logRetrieval(RetrievalOutcome outcome, String questionId) {
        QuestionTrace.withMdc(questionId, () -> {
            log.info("[ForecastFlow] stage={} queries={} questionId={}",
                QUERIES_PLANNED, outcome.queryPlan().totalQueries(), questionId);
            log.info("[ForecastFlow] stage={} articles={} questionId={}",
                ARTICLES_RETRIEVED, outcome.retrieved().size(), questionId);
            log.info("[ForecastFlow] stage={} applied={} questionId={}",
                ARTICLES_PREFILTERED, outcome.preFiltered(), questionId);
            log.info("[ForecastFlow] stage={} articles={} questionId={}",
                ARTICLES_RANKED, outcome.ranked().size(), questionId);
            log.info("[ForecastFlow] stage={} articles={} questionId={}",
                ARTICLES_SUMMARIZED, outcome.summarized().size(), questionId);
        });
    }

    public void logEnsemble(EnsembleResult result, String questionId) {
        QuestionTrace.withMdc(questionId, () -> {
            log.info("[ForecastFlow] stage={} reasonings={} questionId={}",
                BASE_REASONINGS_ELICITED, result.reasoningCount(), questionId);
            log.info("[ForecastFlow] stage={} prediction={} meta={} questionId={}",
                ENSEMBLE_AGGREGATED, result.metaPrediction(), result.metaPrompt() != null, questionId);
        });
    }
}
