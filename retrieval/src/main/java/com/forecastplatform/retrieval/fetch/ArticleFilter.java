package com.forecastplatform.retrieval.fetch;

import com.forecastplatform.common.model.Article;
import com.forecastplatform.retrieval.source.RawDocument;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns raw search hits into articles, dropping hits without a title or link, hits whose
 * text is not longer than the minimum length, and hits from sites whose pages cannot be
 * retrieved.
 */
public class ArticleFilter {

    private final int minLength;
    private final List<String> blockedSites;

    public ArticleFilter(int minLength, List<String> blockedSites) {
        this.minLength = minLength;
        this.blockedSites = blockedSites.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    public Optional<Article> accept(RawDocument doc, String sourceId) {
        if (doc.title() == null || doc.link() == null) return Optional.empty();
        if (doc.text() == null || doc.text().length() <= minLength) return Optional.empty();
        if (isBlocked(doc)) return Optional.empty();
        return Optional.of(Article.of(doc.title(), doc.link(), sourceId, doc.site(), doc.publishDate(), doc.text()));
    }

    boolean isBlocked(RawDocument doc) {
        String link = doc.link().toLowerCase(Locale.ROOT);
        String site = doc.site() == null ? "" : doc.site().toLowerCase(Locale.ROOT);
        for (String blocked : blockedSites) {
            if (site.equals(blocked) || link.contains(blocked)) return true;
        }
        return false;
    }
}
