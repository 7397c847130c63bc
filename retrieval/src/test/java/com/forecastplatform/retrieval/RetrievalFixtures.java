package com.forecastplatform.retrieval;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.DateRange;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.time.LocalDate;
import java.util.List;

/** Shared builders for retrieval tests. */
public final class RetrievalFixtures {

    public static final PromptTemplate QUERY_TEMPLATE = new PromptTemplate("search_query_test",
        "Question: {question}\nGive {num_keywords} queries of at most {max_words} words.\nSearch Queries:");
    public static final PromptTemplate RATING_TEMPLATE = new PromptTemplate("relevance_test",
        "Rate the article for: {question}\n{article}");
    public static final PromptTemplate SUMMARY_TEMPLATE = new PromptTemplate("summary_test", "{article}");

    private RetrievalFixtures() {}

    public static ForecastQuestion question() {
        return ForecastQuestion.of("Will the central bank cut rates by June?", "Inflation has eased.",
            "Resolves YES if the policy rate is lowered.", DateRange.of("2024-01-01", "2024-03-01"),
            LocalDate.of(2024, 6, 30));
    }

    public static RetrievalConfig.Builder config() {
        return RetrievalConfig.builder()
            .queryTemplates(List.of(QUERY_TEMPLATE))
            .rankingTemplate(RATING_TEMPLATE)
            .summarizationTemplate(SUMMARY_TEMPLATE)
            .minArticleLength(10);
    }

    public static Article article(String title, String link) {
        return Article.of(title, link, "newscatcher", "example.com", LocalDate.of(2024, 2, 1),
            "Full text of " + title + " with enough words to pass the length filter.");
    }
}
