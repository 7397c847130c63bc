package com.forecastplatform.retrieval.rank;

import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.common.model.Article;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.util.VectorMath;
import com.forecastplatform.gateway.EmbeddingProvider;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/** Cosine similarity between a question and each article's leading text. */
final class EmbeddingSimilarity {

    private EmbeddingSimilarity() {}

    static String questionText(ForecastQuestion question) {
        String background = question.background() == null ? "" : question.background();
        return "Question: " + question.question() + "\n\nBackground:" + background;
    }

    static Mono<List<Double>> similarities(EmbeddingProvider provider, ForecastQuestion question,
                                           List<Article> articles, int charLimit) {
        List<String> texts = articles.stream()
            .map(a -> a.text().length() > charLimit ? a.text().substring(0, charLimit) : a.text())
            .toList();
        return Mono.zip(provider.embed(List.of(questionText(question))), provider.embed(texts))
            .map(tuple -> {
                if (tuple.getT1().size() != 1 || tuple.getT2().size() != articles.size()) {
                    throw new ForecastException("embedding", "Embedding count does not match input count");
                }
                double[] questionVector = tuple.getT1().get(0);
                List<Double> scores = new ArrayList<>(articles.size());
                for (double[] articleVector : tuple.getT2()) {
                    scores.add(VectorMath.cosineSimilarity(questionVector, articleVector));
                }
                return scores;
            });
    }
}
