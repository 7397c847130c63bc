package com.forecastplatform.common.util;

/** Squared-error scoring of a probability against a resolved binary outcome. */
public final class BrierScore {

    private BrierScore() {}

    public static double of(double probability, double outcome) {
        double diff = probability - outcome;
        return diff * diff;
    }

    /** Null-safe variant used when the question is unresolved or the prediction is missing. */
    public static Double ofNullable(Double probability, Double outcome) {
        if (probability == null || outcome == null) return null;
        return of(probability, outcome);
    }
}
