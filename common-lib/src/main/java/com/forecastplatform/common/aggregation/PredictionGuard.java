package com.forecastplatform.common.aggregation;

import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.model.TokenVocabulary;

/**
 * Final sanity pass over an aggregated prediction.
 *
 * <ul>
 *   <li>Probability outside [0, 1] or NaN becomes 0.5.</li>
 *   <li>Token outside the vocabulary becomes the vocabulary's default token.</li>
 * </ul>
 *
 * <p>Stateless utility; no Spring dependencies.
 */
public final class PredictionGuard {

    public static final double FALLBACK_PROBABILITY = 0.5;

    private PredictionGuard() {}

    public static Prediction clamp(Prediction prediction, TokenVocabulary vocabulary) {
        if (prediction.isProbability()) {
            double p = prediction.probability();
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                return Prediction.ofProbability(FALLBACK_PROBABILITY);
            }
            return prediction;
        }
        if (vocabulary == null || vocabulary.contains(prediction.token())) {
            return prediction;
        }
        return Prediction.ofToken(vocabulary.defaultToken());
    }

    public static boolean isValid(Prediction prediction, TokenVocabulary vocabulary) {
        return clamp(prediction, vocabulary).equals(prediction);
    }
}
