package com.forecastplatform.common.model;

import java.time.LocalDate;

/**
 * A retrieved news article as it moves through the retrieval pipeline.
 *
 * <p>Instances are immutable; each stage produces an enriched copy through the
 * {@code with*} factories. {@code relevanceRating} and {@code ratingReasoning} are set by
 * the ranker (or the pre-filter), {@code summary} by the summarizer.
 */
public record Article(
    String title,
    String link,
    String sourceId,
    String site,
    LocalDate publishDate,
    String text,
    Double relevanceRating,
    String ratingReasoning,
    String summary
) {

    public static Article of(String title, String link, String sourceId, String site,
                             LocalDate publishDate, String text) {
        return new Article(title, link, sourceId, site, publishDate, text, null, null, null);
    }

    public Article withRating(double rating, String reasoning) {
        return new Article(title, link, sourceId, site, publishDate, text, rating, reasoning, summary);
    }

    public Article withSummary(String newSummary) {
        return new Article(title, link, sourceId, site, publishDate, text,
            relevanceRating, ratingReasoning, newSummary);
    }

    public Article withPublishDate(LocalDate date) {
        return new Article(title, link, sourceId, site, date, text,
            relevanceRating, ratingReasoning, summary);
    }

    public boolean hasRating() {
        return relevanceRating != null;
    }
}
