package com.forecastplatform.retrieval.query;

import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.model.SearchQuery;
import com.forecastplatform.common.parse.ResponseParser;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks a completion model for search queries, once per (document source, query template).
 *
 * <p>All calls run concurrently. A response whose query count differs from the requested
 * count is logged and used as-is; a call that fails after the gateway's retries contributes
 * no queries, so the question itself is still searched.
 */
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private final CompletionClient completionClient;

    public QueryPlanner(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public Mono<QueryPlan> plan(ForecastQuestion question, RetrievalConfig config) {
        return Flux.fromIterable(config.sourceWordLimits().entrySet())
            .flatMapSequential(entry -> planForSource(question, config, entry.getKey(), entry.getValue())
                .map(queries -> Map.entry(entry.getKey(), queries)))
            .collectList()
            .map(entries -> {
                Map<String, List<SearchQuery>> bySource = new LinkedHashMap<>();
                entries.forEach(e -> bySource.put(e.getKey(), e.getValue()));
                QueryPlan plan = new QueryPlan(bySource);
                log.info("[QueryPlanner] Queries planned. sources={} total={}",
                    bySource.keySet(), plan.totalQueries());
                return plan;
            });
    }

    private Mono<List<SearchQuery>> planForSource(ForecastQuestion question, RetrievalConfig config,
                                                  String sourceId, int maxWords) {
        return Flux.fromIterable(config.queryTemplates())
            .flatMapSequential(template -> requestQueries(question, config, template, sourceId, maxWords))
            .collectList()
            .map(perTemplate -> {
                Map<String, SearchQuery> unique = new LinkedHashMap<>();
                for (List<SearchQuery> queries : perTemplate) {
                    for (SearchQuery q : queries) unique.putIfAbsent(q.text(), q);
                }
                String questionQuery = QueryCleaner.clean(question.question());
                if (!questionQuery.isEmpty()) {
                    unique.putIfAbsent(questionQuery, new SearchQuery(questionQuery, sourceId, null));
                }
                return List.copyOf(unique.values());
            });
    }

    private Mono<List<SearchQuery>> requestQueries(ForecastQuestion question, RetrievalConfig config,
                                                   PromptTemplate template, String sourceId, int maxWords) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(PromptTemplate.QUESTION, question.question());
        values.put(PromptTemplate.BACKGROUND, nullToEmpty(question.background()));
        values.put(PromptTemplate.RESOLUTION_CRITERIA, nullToEmpty(question.resolutionCriteria()));
        values.put(PromptTemplate.DATE_BEGIN, question.retrievalRange().startText());
        values.put(PromptTemplate.DATE_END, question.retrievalRange().endText());
        values.put(PromptTemplate.NUM_KEYWORDS, config.numSearchQueries());
        values.put(PromptTemplate.MAX_WORDS, maxWords);
        String prompt = template.render(values);

        return completionClient.complete(CompletionRequest.of(config.queryModel(), prompt, config.queryTemperature()))
            .map(response -> toQueries(response, config, template, sourceId))
            .onErrorResume(e -> {
                log.error("[QueryPlanner] Query generation failed, continuing with the question only. "
                    + "source={} template={} reason={}", sourceId, template.id(), e.getMessage());
                return Mono.just(List.of());
            });
    }

    private List<SearchQuery> toQueries(String response, RetrievalConfig config,
                                        PromptTemplate template, String sourceId) {
        List<String> raw = ResponseParser.extractSearchQueries(response);
        if (raw.isEmpty() || raw.size() > config.numSearchQueries()) {
            log.warn("[QueryPlanner] Unexpected query count. source={} template={} expected={} got={}",
                sourceId, template.id(), config.numSearchQueries(), raw.size());
        }
        List<SearchQuery> queries = new ArrayList<>();
        for (String text : raw) {
            if (queries.size() == config.numSearchQueries()) break;
            String cleaned = QueryCleaner.clean(text);
            if (!cleaned.isEmpty()) queries.add(new SearchQuery(cleaned, sourceId, template.id()));
        }
        return queries;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
