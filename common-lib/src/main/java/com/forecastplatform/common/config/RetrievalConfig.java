package com.forecastplatform.common.config;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.prompt.PromptTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings for one retrieval run: query planning, fetching, pre-filtering,
 * ranking and summarization.
 *
 * <p>{@code sourceWordLimits} maps each document source id to the maximum words per search
 * query planned for it; its iteration order is the order sources are queried in.
 */
public record RetrievalConfig(
    int numSearchQueries,
    Map<String, Integer> sourceWordLimits,
    String queryModel,
    double queryTemperature,
    List<PromptTemplate> queryTemplates,
    int articlesPerQuery,
    int minArticleLength,
    List<String> blockedSites,
    boolean preFilterEnabled,
    int preFilterMinPool,
    double preFilterThreshold,
    int preFilterLargePool,
    double preFilterLargeThreshold,
    int embeddingCharLimit,
    RankingMethod rankingMethod,
    RatingDetail ratingDetail,
    String rankingModel,
    double rankingTemperature,
    PromptTemplate rankingTemplate,
    double relevanceThreshold,
    double cosineThreshold,
    SortKey sortBy,
    String summarizationModel,
    double summarizationTemperature,
    PromptTemplate summarizationTemplate,
    int numSummaries,
    int chunkSafetyMargin,
    int maxSummaryDepth,
    int concurrency
) {

    public RetrievalConfig {
        sourceWordLimits = Collections.unmodifiableMap(new LinkedHashMap<>(sourceWordLimits));
        queryTemplates = List.copyOf(queryTemplates);
        blockedSites = List.copyOf(blockedSites);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fails fast on settings that would otherwise surface as a confusing error deep inside
     * the pipeline.
     */
    public RetrievalConfig validate() {
        if (numSearchQueries <= 0) throw new ConfigurationException("numSearchQueries must be positive");
        if (sourceWordLimits.isEmpty()) throw new ConfigurationException("At least one document source is required");
        if (queryTemplates.isEmpty()) throw new ConfigurationException("At least one search query template is required");
        if (sortBy == null) throw new ConfigurationException("Sort key is required");
        if (rankingMethod == RankingMethod.MODEL_RATING && (rankingModel == null || rankingTemplate == null)) {
            throw new ConfigurationException("Model rating needs a ranking model and template");
        }
        if (summarizationModel == null || summarizationTemplate == null) {
            throw new ConfigurationException("Summarization needs a model and template");
        }
        if (maxSummaryDepth <= 0) throw new ConfigurationException("maxSummaryDepth must be positive");
        return this;
    }

    public static final class Builder {
        private int numSearchQueries = 3;
        private Map<String, Integer> sourceWordLimits = new LinkedHashMap<>(Map.of("newscatcher", 5));
        private String queryModel = "gpt-4-1106-preview";
        private double queryTemperature = 0.0;
        private List<PromptTemplate> queryTemplates = List.of();
        private int articlesPerQuery = 5;
        private int minArticleLength = 200;
        private List<String> blockedSites = List.of();
        private boolean preFilterEnabled = true;
        private int preFilterMinPool = 25;
        private double preFilterThreshold = 0.32;
        private int preFilterLargePool = 100;
        private double preFilterLargeThreshold = 0.36;
        private int embeddingCharLimit = 18_000;
        private RankingMethod rankingMethod = RankingMethod.MODEL_RATING;
        private RatingDetail ratingDetail = RatingDetail.TITLE_EXCERPT;
        private String rankingModel = "gpt-3.5-turbo-1106";
        private double rankingTemperature = 0.0;
        private PromptTemplate rankingTemplate;
        private double relevanceThreshold = 4.0;
        private double cosineThreshold = 0.5;
        private SortKey sortBy = SortKey.DATE;
        private String summarizationModel = "gpt-3.5-turbo-1106";
        private double summarizationTemperature = 0.2;
        private PromptTemplate summarizationTemplate;
        private int numSummaries = 20;
        private int chunkSafetyMargin = 1000;
        private int maxSummaryDepth = 8;
        private int concurrency = 8;

        private Builder() {}

        public Builder numSearchQueries(int v) { this.numSearchQueries = v; return this; }
        public Builder sourceWordLimits(Map<String, Integer> v) { this.sourceWordLimits = new LinkedHashMap<>(v); return this; }
        public Builder queryModel(String v) { this.queryModel = v; return this; }
        public Builder queryTemperature(double v) { this.queryTemperature = v; return this; }
        public Builder queryTemplates(List<PromptTemplate> v) { this.queryTemplates = v; return this; }
        public Builder articlesPerQuery(int v) { this.articlesPerQuery = v; return this; }
        public Builder minArticleLength(int v) { this.minArticleLength = v; return this; }
        public Builder blockedSites(List<String> v) { this.blockedSites = v; return this; }
        public Builder preFilterEnabled(boolean v) { this.preFilterEnabled = v; return this; }
        public Builder preFilterMinPool(int v) { this.preFilterMinPool = v; return this; }
        public Builder preFilterThreshold(double v) { this.preFilterThreshold = v; return this; }
        public Builder preFilterLargePool(int v) { this.preFilterLargePool = v; return this; }
        public Builder preFilterLargeThreshold(double v) { this.preFilterLargeThreshold = v; return this; }
        public Builder embeddingCharLimit(int v) { this.embeddingCharLimit = v; return this; }
        public Builder rankingMethod(RankingMethod v) { this.rankingMethod = v; return this; }
        public Builder ratingDetail(RatingDetail v) { this.ratingDetail = v; return this; }
        public Builder rankingModel(String v) { this.rankingModel = v; return this; }
        public Builder rankingTemperature(double v) { this.rankingTemperature = v; return this; }
        public Builder rankingTemplate(PromptTemplate v) { this.rankingTemplate = v; return this; }
        public Builder relevanceThreshold(double v) { this.relevanceThreshold = v; return this; }
        public Builder cosineThreshold(double v) { this.cosineThreshold = v; return this; }
        public Builder sortBy(SortKey v) { this.sortBy = v; return this; }
        public Builder summarizationModel(String v) { this.summarizationModel = v; return this; }
        public Builder summarizationTemperature(double v) { this.summarizationTemperature = v; return this; }
        public Builder summarizationTemplate(PromptTemplate v) { this.summarizationTemplate = v; return this; }
        public Builder numSummaries(int v) { this.numSummaries = v; return this; }
        public Builder chunkSafetyMargin(int v) { this.chunkSafetyMargin = v; return this; }
        public Builder maxSummaryDepth(int v) { this.maxSummaryDepth = v; return this; }
        public Builder concurrency(int v) { this.concurrency = v; return this; }

        public RetrievalConfig build() {
            return new RetrievalConfig(numSearchQueries, sourceWordLimits, queryModel, queryTemperature,
                queryTemplates, articlesPerQuery, minArticleLength, blockedSites, preFilterEnabled,
                preFilterMinPool, preFilterThreshold, preFilterLargePool, preFilterLargeThreshold,
                embeddingCharLimit, rankingMethod, ratingDetail, rankingModel, rankingTemperature,
                rankingTemplate, relevanceThreshold, cosineThreshold, sortBy, summarizationModel,
                summarizationTemperature, summarizationTemplate, numSummaries, chunkSafetyMargin,
                maxSummaryDepth, concurrency);
        }
    }
}
