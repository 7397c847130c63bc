package com.forecastplatform.common.util;

/** Stateless vector helpers for embedding comparisons. */
public final class VectorMath {

    private VectorMath() {}

    /**
     * Cosine similarity of two equal-length vectors. Returns 0.0 when either vector has zero norm.
     *
     * @throws IllegalArgumentException when the dimensions differ
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
