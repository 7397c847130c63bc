package com.forecastplatform.retrieval.query;

import com.forecastplatform.common.model.SearchQuery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search queries per document source, in the order sources should be queried.
 * Each source's list is cleaned, duplicate-free and ends with the question itself
 * unless a planned query already equals it.
 */
public record QueryPlan(Map<String, List<SearchQuery>> bySource) {

    public QueryPlan {
        Map<String, List<SearchQuery>> copy = new LinkedHashMap<>();
        bySource.forEach((source, queries) -> copy.put(source, List.copyOf(queries)));
        bySource = Collections.unmodifiableMap(copy);
    }

    public List<String> queriesFor(String sourceId) {
        return bySource.getOrDefault(sourceId, List.of()).stream().map(SearchQuery::text).toList();
    }

    public int totalQueries() {
        return bySource.values().stream().mapToInt(List::size).sum();
    }
}
