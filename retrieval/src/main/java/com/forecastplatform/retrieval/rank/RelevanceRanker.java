package com.forecastplatform.retrieval.rank;

import com.forecastplatform.common.config.RankingMethod;
import com.forecastplatform.common.config.RatingDetail;
import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.parse.ResponseParser;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import com.forecastplatform.gateway.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rates every article's relevance to the question, then filters and sorts.
 *
 * <p>With {@link RankingMethod#MODEL_RATING} each article gets one concurrent completion
 * call; the 1-6 rating and the model's reasoning are stored on the article. A rating call
 * that still fails after the gateway's retries rates the article 1, which the threshold
 * normally drops. With {@link RankingMethod#EMBEDDING} the cosine similarity is the rating
 * and the cosine threshold applies.
 */
public class RelevanceRanker {

    private static final Logger log = LoggerFactory.getLogger(RelevanceRanker.class);

    static final int FULL_TEXT_CHAR_LIMIT = 40_000;
    static final int EXCERPT_TOKENS = 250;
    static final int CHARS_PER_TOKEN = 4;

    private final CompletionClient completionClient;
    private final EmbeddingProvider embeddingProvider;

    public RelevanceRanker(CompletionClient completionClient, EmbeddingProvider embeddingProvider) {
        this.completionClient = completionClient;
        this.embeddingProvider = embeddingProvider;
    }

    public Mono<List<Article>> rank(ForecastQuestion question, List<Article> articles, RetrievalConfig config) {
        if (articles.isEmpty()) return Mono.just(List.of());

        boolean byEmbedding = config.rankingMethod() == RankingMethod.EMBEDDING;
        Mono<List<Article>> rated = byEmbedding
            ? rateByEmbedding(question, articles, config)
            : rateByModel(question, articles, config);
        double threshold = byEmbedding ? config.cosineThreshold() : config.relevanceThreshold();

        return rated.map(list -> {
            List<Article> ranked = ArticleSorter.sortAndFilter(list, threshold, config.sortBy(),
                question.retrievalRange().end());
            log.info("[Ranker] Articles ranked. method={} rated={} kept={} threshold={} sortBy={}",
                config.rankingMethod().value(), list.size(), ranked.size(), threshold, config.sortBy().value());
            return ranked;
        });
    }

    private Mono<List<Article>> rateByModel(ForecastQuestion question, List<Article> articles, RetrievalConfig config) {
        return Flux.fromIterable(articles)
            .flatMapSequential(article -> rateOne(question, article, config), config.concurrency())
            .collectList();
    }

    private Mono<Article> rateOne(ForecastQuestion question, Article article, RetrievalConfig config) {
        String prompt = config.rankingTemplate().render(Map.of(
            PromptTemplate.QUESTION, question.question(),
            PromptTemplate.BACKGROUND, question.background() == null ? "" : question.background(),
            PromptTemplate.RESOLUTION_CRITERIA,
            question.resolutionCriteria() == null ? "" : question.resolutionCriteria(),
            PromptTemplate.ARTICLE, articleBlock(article, config.ratingDetail())));

        return completionClient.complete(CompletionRequest.of(config.rankingModel(), prompt, config.rankingTemperature()))
            .map(response -> article.withRating(ResponseParser.extractRating(response), response))
            .onErrorResume(e -> {
                log.error("[Ranker] Rating failed, assigning the minimum rating. link={} reason={}",
                    article.link(), e.getMessage());
                return Mono.just(article.withRating(ResponseParser.DEFAULT_RATING,
                    "Rating unavailable: " + e.getMessage()));
            });
    }

    private Mono<List<Article>> rateByEmbedding(ForecastQuestion question, List<Article> articles,
                                                RetrievalConfig config) {
        return EmbeddingSimilarity.similarities(embeddingProvider, question, articles, config.embeddingCharLimit())
            .map(scores -> {
                List<Article> rated = new ArrayList<>(articles.size());
                for (int i = 0; i < articles.size(); i++) {
                    rated.add(articles.get(i).withRating(scores.get(i), "cosine similarity"));
                }
                return rated;
            });
    }

    static String articleBlock(Article article, RatingDetail detail) {
        switch (detail) {
            case FULL_TEXT:
                return "\n---\nTitle: " + article.title() + "\n\n"
                    + truncate(article.text(), FULL_TEXT_CHAR_LIMIT) + "\n---\n";
            case TITLE_EXCERPT:
                return "\n---\nTitle: " + article.title() + "\n\n"
                    + "(Below I provide the first " + EXCERPT_TOKENS + " tokens of the article.)\n"
                    + truncate(article.text(), EXCERPT_TOKENS * CHARS_PER_TOKEN) + "\n---\n";
            case TITLE:
            default:
                return "\n---\nTitle: " + article.title() + "\n---\n";
        }
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) return "";
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
