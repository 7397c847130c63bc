package com.forecastplatform.common.model;

/** Shape of a forecaster's answer. */
public enum AnswerType {
    /** A number in [0, 1]. */
    PROBABILITY,
    /** A phrase from a fixed {@link TokenVocabulary}. */
    TOKENS
}
