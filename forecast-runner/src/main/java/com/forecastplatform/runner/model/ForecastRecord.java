package com.forecastplatform.runner.model;

import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.EnsembleResult;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.model.TokenVocabulary;
import com.forecastplatform.common.util.BrierScore;
import com.forecastplatform.retrieval.RetrievalOutcome;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted artifact of one forecast: retrieval trace, every base reasoning, the final
 * prediction and, for resolved questions, Brier scores.
 *
 * <p>{@code finalProbability} is always set; for token answers it is the vocabulary's
 * probability of {@code finalToken}.
 */
public record ForecastRecord(
    ForecastQuestion question,
    int retrievalIndex,
    Map<String, List<String>> searchQueries,
    int retrievedCount,
    boolean preFiltered,
    List<Article> summarizedArticles,
    String evidenceDigest,
    List<List<ReasoningEntry>> baseReasonings,
    Double finalProbability,
    String finalToken,
    String metaPrompt,
    String metaReasoning,
    List<List<Double>> alignmentScores,
    List<List<Double>> baseBrierScores,
    Double metaBrierScore,
    Double communityBrierScore,
    Instant createdAt
) {

    public static ForecastRecord assemble(ForecastQuestion question, int retrievalIndex,
                                          RetrievalOutcome retrieval, EnsembleResult ensemble,
                                          List<List<Double>> alignmentScores, TokenVocabulary vocabulary,
                                          Instant createdAt) {
        Map<String, List<String>> queries = new LinkedHashMap<>();
        retrieval.queryPlan().bySource().keySet()
            .forEach(source -> queries.put(source, retrieval.queryPlan().queriesFor(source)));

        List<List<ReasoningEntry>> reasonings = ensemble.baseReasonings().stream()
            .map(group -> group.stream().map(ReasoningEntry::from).toList())
            .toList();

        Prediction meta = ensemble.metaPrediction();
        double finalProbability = meta.asProbability(vocabulary);
        Double answer = question.answer();

        List<List<Double>> baseBrier = answer == null ? List.of() : ensemble.basePredictions().stream()
            .map(group -> group.stream().map(p -> BrierScore.of(p.asProbability(vocabulary), answer)).toList())
            .toList();

        return new ForecastRecord(question, retrievalIndex, queries, retrieval.retrieved().size(),
            retrieval.preFiltered(), retrieval.summarized(), retrieval.digest(), reasonings,
            finalProbability, meta.isProbability() ? null : meta.token(),
            ensemble.metaPrompt(), ensemble.metaReasoning(), alignmentScores,
            baseBrier, BrierScore.ofNullable(finalProbability, answer),
            BrierScore.ofNullable(question.communityPrediction(), answer),
            createdAt);
    }
}
