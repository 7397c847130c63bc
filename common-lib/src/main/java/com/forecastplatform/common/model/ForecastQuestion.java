package com.forecastplatform.common.model;

import java.time.LocalDate;

/**
 * A binary forecasting question as it enters the pipeline.
 *
 * <p>{@code retrievalRange} bounds the news search; the forecast horizon runs from the end of
 * that range to {@code closeDate}. {@code answer} and {@code communityPrediction} are only
 * present for resolved questions and are used for scoring, never for reasoning.
 */
public record ForecastQuestion(
    String question,
    String background,
    String resolutionCriteria,
    DateRange retrievalRange,
    LocalDate closeDate,
    Double answer,
    Double communityPrediction
) {

    public static ForecastQuestion of(String question, String background, String resolutionCriteria,
                                      DateRange retrievalRange, LocalDate closeDate) {
        return new ForecastQuestion(question, background, resolutionCriteria,
            retrievalRange, closeDate, null, null);
    }

    public ForecastQuestion withResolution(Double answer, Double communityPrediction) {
        return new ForecastQuestion(question, background, resolutionCriteria,
            retrievalRange, closeDate, answer, communityPrediction);
    }

    /** Window the forecasters are asked about: retrieval cut-off to question close. */
    public DateRange forecastWindow() {
        LocalDate from = retrievalRange == null ? null : retrievalRange.end();
        return new DateRange(from, closeDate);
    }

    public boolean isResolved() {
        return answer != null;
    }
}
