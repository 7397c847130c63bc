package com.forecastplatform.reasoning.ensemble;

import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.util.HashMap;
import java.util.Map;

/** Prompt values shared by base and meta reasoning templates. */
final class ReasoningPrompts {

    private ReasoningPrompts() {}

    static Map<String, Object> values(ForecastQuestion question, String digest) {
        Map<String, Object> values = new HashMap<>();
        values.put(PromptTemplate.QUESTION, question.question());
        values.put(PromptTemplate.BACKGROUND, nullToEmpty(question.background()));
        values.put(PromptTemplate.RESOLUTION_CRITERIA, nullToEmpty(question.resolutionCriteria()));
        values.put(PromptTemplate.DATE_BEGIN, question.forecastWindow().startText());
        values.put(PromptTemplate.DATE_END, question.forecastWindow().endText());
        values.put(PromptTemplate.RETRIEVED_INFO, digest);
        return values;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
