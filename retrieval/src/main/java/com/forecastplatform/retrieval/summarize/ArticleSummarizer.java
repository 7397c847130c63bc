package com.forecastplatform.retrieval.summarize;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.gateway.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Summarizes the top-ranked articles concurrently, keeping rank order. A summary that comes
 * back longer than the article it summarizes is replaced by the article text.
 */
public class ArticleSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ArticleSummarizer.class);

    private final RecursiveSummarizer summarizer;
    private final TokenCounter tokenCounter;

    public ArticleSummarizer(RecursiveSummarizer summarizer, TokenCounter tokenCounter) {
        this.summarizer = summarizer;
        this.tokenCounter = tokenCounter;
    }

    public Mono<List<Article>> summarizeTop(ForecastQuestion question, List<Article> ranked, RetrievalConfig config) {
        if (ranked.isEmpty()) return Mono.just(List.of());
        List<Article> top = ranked.subList(0, Math.min(config.numSummaries(), ranked.size()));
        SummarySettings settings = SummarySettings.from(config, question);

        return Flux.fromIterable(top)
            .flatMapSequential(article -> summarizer.summarize(article.text(), settings)
                .map(outcome -> article.withSummary(notLongerThanText(outcome.text(), article, settings.model()))),
                config.concurrency())
            .collectList()
            .doOnNext(list -> log.info("[Summarizer] Articles summarized. ranked={} summarized={}",
                ranked.size(), list.size()));
    }

    private String notLongerThanText(String summary, Article article, String model) {
        if (tokenCounter.count(summary, model) <= tokenCounter.count(article.text(), model)) return summary;
        log.debug("[Summarizer] Summary longer than article, keeping article text. link={}", article.link());
        return article.text();
    }
}
