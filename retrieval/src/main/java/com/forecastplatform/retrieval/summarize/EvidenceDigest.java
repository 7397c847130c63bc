package com.forecastplatform.retrieval.summarize;

import com.forecastplatform.common.model.Article;

import java.util.ArrayList;
import java.util.List;

/** Renders summarized articles into the text block forecasters read. */
public final class EvidenceDigest {

    public static final String EMPTY = "---\nNo articles were retrieved for this question.\n----";

    private EvidenceDigest() {}

    public static String render(List<Article> articles) {
        if (articles.isEmpty()) return EMPTY;
        List<String> entries = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            Article a = articles.get(i);
            String date = a.publishDate() == null ? "unknown date" : a.publishDate().toString();
            String summary = a.summary() == null ? a.text() : a.summary();
            entries.add("[" + (i + 1) + "] " + a.title() + " (published on " + date + ")\nSummary: " + summary + "\n");
        }
        return "---\nARTICLES\n" + String.join("\n", entries) + "----";
    }
}
