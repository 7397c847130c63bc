package com.forecastplatform.retrieval.fetch;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.DateRange;
import com.forecastplatform.retrieval.query.QueryPlan;
import com.forecastplatform.retrieval.source.DocumentSource;
import com.forecastplatform.retrieval.source.RawDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every planned query against its document source and merges the hits.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>An invalid date range returns an empty list without contacting any source.</li>
 *   <li>Fetches run concurrently but results keep source-then-query order, so
 *       deduplication always keeps the same first occurrence.</li>
 *   <li>A failing (source, query) pair is logged and contributes nothing.</li>
 * </ul>
 */
public class MultiSourceRetriever {

    private static final Logger log = LoggerFactory.getLogger(MultiSourceRetriever.class);

    private final Map<String, DocumentSource> sources = new LinkedHashMap<>();

    public MultiSourceRetriever(List<DocumentSource> sources) {
        for (DocumentSource source : sources) {
            this.sources.put(source.id(), source);
        }
    }

    public Mono<List<Article>> retrieve(QueryPlan plan, DateRange range, RetrievalConfig config) {
        if (range == null || !range.isValid()) {
            log.error("[Retriever] End date must be after start date, skipping retrieval. range={}", range);
            return Mono.just(List.of());
        }

        List<FetchJob> jobs = new ArrayList<>();
        plan.bySource().forEach((sourceId, queries) -> {
            DocumentSource source = sources.get(sourceId);
            if (source == null) {
                log.warn("[Retriever] No document source registered, skipping its queries. source={}", sourceId);
                return;
            }
            queries.forEach(q -> jobs.add(new FetchJob(source, q.text())));
        });

        ArticleFilter filter = new ArticleFilter(config.minArticleLength(), config.blockedSites());
        return Flux.fromIterable(jobs)
            .flatMapSequential(job -> fetch(job, range, config.articlesPerQuery(), filter), config.concurrency())
            .collectList()
            .map(perJob -> {
                List<Article> all = new ArrayList<>();
                perJob.forEach(all::addAll);
                List<Article> unique = ArticleDeduplicator.deduplicate(all);
                log.info("[Retriever] Articles retrieved. queries={} hits={} unique={}",
                    jobs.size(), all.size(), unique.size());
                return unique;
            });
    }

    private Mono<List<Article>> fetch(FetchJob job, DateRange range, int cap, ArticleFilter filter) {
        return job.source().search(job.query(), range, cap)
            .map(docs -> {
                List<Article> kept = new ArrayList<>();
                for (RawDocument doc : docs.subList(0, Math.min(cap, docs.size()))) {
                    Optional<Article> article = filter.accept(doc, job.source().id());
                    article.ifPresent(kept::add);
                }
                return kept;
            })
            .onErrorResume(e -> {
                log.warn("[Retriever] Fetch failed, skipping. source={} query={} reason={}",
                    job.source().id(), job.query(), e.getMessage());
                return Mono.just(List.of());
            });
    }

    private record FetchJob(DocumentSource source, String query) {}
}
