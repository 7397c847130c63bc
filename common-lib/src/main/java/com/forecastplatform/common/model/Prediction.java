package com.forecastplatform.common.model;

/**
 * A single forecast value. Exactly one of {@code probability} / {@code token} is meaningful,
 * selected by {@code type}.
 */
public record Prediction(AnswerType type, double probability, String token) {

    public static Prediction ofProbability(double probability) {
        return new Prediction(AnswerType.PROBABILITY, probability, null);
    }

    public static Prediction ofToken(String token) {
        return new Prediction(AnswerType.TOKENS, Double.NaN, token);
    }

    public boolean isProbability() {
        return type == AnswerType.PROBABILITY;
    }

    /**
     * Numeric view of the prediction. Token answers resolve through the vocabulary,
     * which is required for token predictions only.
     */
    public double asProbability(TokenVocabulary vocabulary) {
        if (isProbability()) return probability;
        return vocabulary.probabilityOf(token);
    }

    @Override
    public String toString() {
        return isProbability() ? String.valueOf(probability) : token;
    }
}
