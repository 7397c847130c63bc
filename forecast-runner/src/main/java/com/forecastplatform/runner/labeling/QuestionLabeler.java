package com.forecastplatform.runner.labeling;

import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Offline labeling of question sets: a topic category and an ill-defined-title flag.
 *
 * <p>Runs on a fixed-size thread pool issuing blocking completion calls, one task per
 * question. A failed question is logged and returned unlabeled; it never aborts the set.
 */
public class QuestionLabeler {

    private static final Logger log = LoggerFactory.getLogger(QuestionLabeler.class);

    public static final List<String> CATEGORIES = List.of(
        "Science & Tech",
        "Healthcare & Biology",
        "Economics & Business",
        "Environment & Energy",
        "Politics & Governance",
        "Education & Research",
        "Arts & Recreation",
        "Security & Defense",
        "Social Sciences",
        "Sports",
        "Other");

    static final String FALLBACK_CATEGORY = "Other";
    static final String CLASSIFICATION_MARKER = "Classification:";

    private static final double TEMPERATURE = 0.1;
    private static final int MAX_TOKENS = 500;

    private final CompletionClient completionClient;
    private final String model;
    private final PromptTemplate categoryTemplate;
    private final PromptTemplate titleTemplate;
    private final int threads;

    public QuestionLabeler(CompletionClient completionClient, String model,
                           PromptTemplate categoryTemplate, PromptTemplate titleTemplate, int threads) {
        this.completionClient = completionClient;
        this.model = model;
        this.categoryTemplate = categoryTemplate;
        this.titleTemplate = titleTemplate;
        this.threads = Math.max(1, threads);
    }

    /** Labels in input order. Blocks until every question is done. */
    public List<QuestionLabel> label(List<ForecastQuestion> questions) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<QuestionLabel>> futures = new ArrayList<>(questions.size());
            for (ForecastQuestion question : questions) {
                futures.add(pool.submit(() -> labelOne(question)));
            }
            List<QuestionLabel> labels = new ArrayList<>(questions.size());
            for (int i = 0; i < futures.size(); i++) {
                labels.add(await(futures.get(i), questions.get(i)));
            }
            log.info("[Labeler] Labeling finished. questions={} threads={}", questions.size(), threads);
            return labels;
        } finally {
            pool.shutdownNow();
        }
    }

    private QuestionLabel await(Future<QuestionLabel> future, ForecastQuestion question) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForecastException("labeling", "Interrupted while labeling", e);
        } catch (ExecutionException e) {
            log.error("[Labeler] Labeling failed. question={} reason={}",
                question.question(), e.getCause().getMessage());
            return QuestionLabel.unlabeled(question.question());
        }
    }

    private QuestionLabel labelOne(ForecastQuestion question) {
        Map<String, Object> values = new HashMap<>();
        values.put(PromptTemplate.QUESTION, question.question());
        values.put(PromptTemplate.BACKGROUND, question.background() == null ? "" : question.background());

        String categoryResponse = completionClient.completeBlocking(
            CompletionRequest.of(model, categoryTemplate.render(values), TEMPERATURE).withMaxTokens(MAX_TOKENS));
        String titleResponse = completionClient.completeBlocking(
            CompletionRequest.of(model, titleTemplate.render(values), TEMPERATURE).withMaxTokens(MAX_TOKENS));

        Boolean illDefined = parseIllDefined(titleResponse).orElse(null);
        if (illDefined == null) {
            log.error("[Labeler] No classification in response. question={}", question.question());
        } else if (illDefined) {
            log.info("[Labeler] Question flagged as ill-defined. question={}", question.question());
        }
        return new QuestionLabel(question.question(), parseCategory(categoryResponse), illDefined);
    }

    /**
     * Exact match first (ignoring case and quotes), then the first category named anywhere
     * in the response, else {@value #FALLBACK_CATEGORY}.
     */
    static String parseCategory(String response) {
        if (response == null) return FALLBACK_CATEGORY;
        String cleaned = response.replace("'", "").replace("\"", "").trim();
        for (String category : CATEGORIES) {
            if (category.equalsIgnoreCase(cleaned)) return category;
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        return CATEGORIES.stream()
            .filter(category -> lower.contains(category.toLowerCase(Locale.ROOT)))
            .findFirst()
            .orElse(FALLBACK_CATEGORY);
    }

    /**
     * Reads the answer after {@value #CLASSIFICATION_MARKER}: "ok" is well defined, "flag" and
     * anything ambiguous are ill-defined. Empty when the marker is missing.
     */
    static Optional<Boolean> parseIllDefined(String response) {
        if (response == null) return Optional.empty();
        int marker = response.indexOf(CLASSIFICATION_MARKER);
        if (marker < 0) return Optional.empty();
        String answer = response.substring(marker + CLASSIFICATION_MARKER.length());
        if (answer.contains("ok")) return Optional.of(false);
        return Optional.of(true);
    }
}
