package com.forecastplatform.retrieval.rank;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.gateway.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cheap similarity cut applied before model rating when the article pool is large.
 *
 * <p>Emits {@link Optional#empty()} when the filter was skipped: disabled, pool below the
 * minimum size, or the embedding call failed. Callers then continue with the unfiltered
 * pool. A present value holds only articles whose cosine similarity to the question is
 * strictly above the threshold, with the similarity stored as their rating.
 */
public class EmbeddingPreFilter {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingPreFilter.class);

    private final EmbeddingProvider embeddingProvider;

    public EmbeddingPreFilter(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    public Mono<Optional<List<Article>>> filter(ForecastQuestion question, List<Article> articles,
                                                RetrievalConfig config) {
        if (!config.preFilterEnabled() || articles.size() < config.preFilterMinPool()) {
            return Mono.just(Optional.empty());
        }
        double threshold = articles.size() >= config.preFilterLargePool()
            ? config.preFilterLargeThreshold()
            : config.preFilterThreshold();

        return EmbeddingSimilarity.similarities(embeddingProvider, question, articles, config.embeddingCharLimit())
            .map(scores -> {
                List<Article> kept = new ArrayList<>();
                for (int i = 0; i < articles.size(); i++) {
                    double score = scores.get(i);
                    if (score > threshold) {
                        kept.add(articles.get(i).withRating(score, "cosine similarity"));
                    }
                }
                log.info("[PreFilter] Articles pre-filtered. before={} after={} threshold={}",
                    articles.size(), kept.size(), threshold);
                return Optional.of(kept);
            })
            .onErrorResume(e -> {
                log.warn("[PreFilter] Embedding failed, continuing with the unfiltered pool. size={} reason={}",
                    articles.size(), e.getMessage());
                return Mono.just(Optional.empty());
            });
    }
}
