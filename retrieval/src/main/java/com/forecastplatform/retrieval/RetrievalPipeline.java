package com.forecastplatform.retrieval;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.DateRange;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.retrieval.fetch.MultiSourceRetriever;
import com.forecastplatform.retrieval.query.QueryPlan;
import com.forecastplatform.retrieval.query.QueryPlanner;
import com.forecastplatform.retrieval.rank.EmbeddingPreFilter;
import com.forecastplatform.retrieval.rank.RelevanceRanker;
import com.forecastplatform.retrieval.summarize.ArticleSummarizer;
import com.forecastplatform.retrieval.summarize.EvidenceDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * plan → retrieve → pre-filter → rank → summarize → digest, for one question.
 */
public class RetrievalPipeline {

    private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

    private final QueryPlanner queryPlanner;
    private final MultiSourceRetriever retriever;
    private final EmbeddingPreFilter preFilter;
    private final RelevanceRanker ranker;
    private final ArticleSummarizer summarizer;

    public RetrievalPipeline(QueryPlanner queryPlanner, MultiSourceRetriever retriever,
                             EmbeddingPreFilter preFilter, RelevanceRanker ranker,
                             ArticleSummarizer summarizer) {
        this.queryPlanner = queryPlanner;
        this.retriever = retriever;
        this.preFilter = preFilter;
        this.ranker = ranker;
        this.summarizer = summarizer;
    }

    public Mono<RetrievalOutcome> run(ForecastQuestion question, RetrievalConfig config) {
        DateRange range = question.retrievalRange();
        if (range == null || !range.isValid()) {
            log.error("[Retrieval] End date must be after start date, skipping retrieval. question={} range={}",
                question.question(), range);
            return Mono.fromCallable(config::validate)
                .map(valid -> RetrievalOutcome.empty());
        }
        return Mono.fromCallable(config::validate)
            .flatMap(valid -> queryPlanner.plan(question, valid))
            .flatMap(plan -> retriever.retrieve(plan, question.retrievalRange(), config)
                .flatMap(retrieved -> rankAndSummarize(question, config, plan, retrieved)));
    }

    private Mono<RetrievalOutcome> rankAndSummarize(ForecastQuestion question, RetrievalConfig config,
                                                    QueryPlan plan, List<Article> retrieved) {
        return preFilter.filter(question, retrieved, config)
            .flatMap(filtered -> {
                List<Article> pool = filtered.orElse(retrieved);
                boolean applied = filtered.isPresent();
                return ranker.rank(question, pool, config)
                    .flatMap(ranked -> summarizer.summarizeTop(question, ranked, config)
                        .map(summarized -> new RetrievalOutcome(plan, retrieved, applied, ranked, summarized,
                            EvidenceDigest.render(summarized))));
            })
            .doOnNext(outcome -> log.info("[Retrieval] Retrieval finished. retrieved={} preFiltered={} ranked={} summarized={}",
                outcome.retrieved().size(), outcome.preFiltered(), outcome.ranked().size(),
                outcome.summarized().size()));
    }
}
