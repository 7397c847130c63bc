package com.forecastplatform.retrieval.rank;

import com.forecastplatform.common.config.SortKey;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.Article;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Threshold filter and descending sort over rated articles.
 *
 * <p>Articles without a rating, or rated below the threshold, are dropped. When sorting by
 * date, articles without a publish date take {@code defaultDate} (the retrieval end date)
 * first. Ties keep their input order.
 */
public final class ArticleSorter {

    private ArticleSorter() {}

    public static List<Article> sortAndFilter(List<Article> articles, double threshold,
                                              String sortKey, LocalDate defaultDate) {
        return sortAndFilter(articles, threshold, SortKey.fromValue(sortKey), defaultDate);
    }

    public static List<Article> sortAndFilter(List<Article> articles, double threshold,
                                              SortKey sortKey, LocalDate defaultDate) {
        if (sortKey == null) throw new ConfigurationException("Sort key is required");

        List<Article> kept = new ArrayList<>();
        for (Article a : articles) {
            if (!a.hasRating() || a.relevanceRating() < threshold) continue;
            kept.add(a.publishDate() == null && sortKey == SortKey.DATE ? a.withPublishDate(defaultDate) : a);
        }

        Comparator<Article> order = sortKey == SortKey.DATE
            ? Comparator.comparing(Article::publishDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            : Comparator.comparing(Article::relevanceRating);
        kept.sort(order.reversed());
        return kept;
    }
}
