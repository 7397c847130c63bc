package com.forecastplatform.retrieval.summarize;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything the recursive summarizer needs apart from the text itself.
 *
 * @param template          summarization prompt; the text goes into {@code {article}}
 * @param context           remaining prompt values (question, background)
 * @param model             summarization model
 * @param temperature       sampling temperature
 * @param chunkSafetyMargin tokens reserved for the prompt around each chunk
 * @param maxDepth          maximum number of split-and-summarize rounds
 * @param concurrency       concurrent chunk calls per round
 */
public record SummarySettings(
    PromptTemplate template,
    Map<String, String> context,
    String model,
    double temperature,
    int chunkSafetyMargin,
    int maxDepth,
    int concurrency
) {

    public SummarySettings {
        context = Map.copyOf(context);
    }

    public static SummarySettings from(RetrievalConfig config, ForecastQuestion question) {
        Map<String, String> context = new HashMap<>();
        context.put(PromptTemplate.QUESTION, question.question());
        context.put(PromptTemplate.BACKGROUND, question.background() == null ? "" : question.background());
        return new SummarySettings(config.summarizationTemplate(), context, config.summarizationModel(),
            config.summarizationTemperature(), config.chunkSafetyMargin(), config.maxSummaryDepth(),
            config.concurrency());
    }

    String prompt(String text) {
        Map<String, Object> values = new HashMap<>(context);
        values.put(PromptTemplate.ARTICLE, text);
        return template.render(values);
    }
}
