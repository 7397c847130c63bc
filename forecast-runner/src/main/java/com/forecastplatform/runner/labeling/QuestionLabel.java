package com.forecastplatform.runner.labeling;

/**
 * Labels assigned to one question. {@code category} is {@code null} when labeling failed;
 * {@code illDefined} is {@code null} when the model's answer could not be read.
 */
public record QuestionLabel(String question, String category, Boolean illDefined) {

    static QuestionLabel unlabeled(String question) {
        return new QuestionLabel(question, null, null);
    }
}
