package com.forecastplatform.reasoning.ensemble;

import com.forecastplatform.common.model.BaseReasoning;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the prompt that asks one model to weigh every base forecaster's reasoning.
 */
public final class MetaPromptBuilder {

    private MetaPromptBuilder() {}

    /**
     * Numbers the reasonings in flattened order:
     * <pre>
     * ---
     * Response from forecaster 1:
     * ...
     *
     * -
     * Response from forecaster 2:
     * ...
     * ---
     * </pre>
     */
    public static String concatenate(List<String> reasonings) {
        List<String> entries = new ArrayList<>(reasonings.size());
        for (int i = 0; i < reasonings.size(); i++) {
            entries.add("Response from forecaster " + (i + 1) + ":\n" + reasonings.get(i));
        }
        return "---\n" + String.join("\n\n-\n", entries) + "\n---";
    }

    public static String build(PromptTemplate template, ForecastQuestion question, String digest,
                               List<List<BaseReasoning>> groupedReasonings) {
        List<String> flat = new ArrayList<>();
        groupedReasonings.forEach(group -> group.forEach(r -> flat.add(r.reasoning())));
        Map<String, Object> values = ReasoningPrompts.values(question, digest);
        values.put(PromptTemplate.BASE_REASONINGS, concatenate(flat));
        return template.render(values);
    }
}
