package com.forecastplatform.retrieval.fetch;

import com.forecastplatform.common.model.Article;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops repeated articles while keeping the first occurrence in place.
 *
 * <p>An article repeats an earlier one when its link or its title matches, ignoring case.
 * Articles missing either field are dropped.
 */
public final class ArticleDeduplicator {

    private ArticleDeduplicator() {}

    public static List<Article> deduplicate(List<Article> articles) {
        Set<String> seenLinks = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        List<Article> unique = new ArrayList<>();
        for (Article a : articles) {
            if (a.link() == null || a.title() == null) continue;
            String link = a.link().toLowerCase(Locale.ROOT);
            String title = a.title().toLowerCase(Locale.ROOT);
            if (seenLinks.contains(link) || seenTitles.contains(title)) continue;
            seenLinks.add(link);
            seenTitles.add(title);
            unique.add(a);
        }
        return unique;
    }
}
