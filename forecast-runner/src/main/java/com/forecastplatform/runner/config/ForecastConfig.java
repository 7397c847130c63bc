package com.forecastplatform.runner.config;

import com.forecastplatform.common.config.AggregationMethod;
import com.forecastplatform.common.config.RankingMethod;
import com.forecastplatform.common.config.RatingDetail;
import com.forecastplatform.common.config.ReasoningConfig;
import com.forecastplatform.common.config.RetrievalConfig;
import com.forecastplatform.common.config.SortKey;
import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.model.TokenVocabulary;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.EmbeddingProvider;
import com.forecastplatform.gateway.ModelCatalog;
import com.forecastplatform.gateway.token.TokenCounter;
import com.forecastplatform.reasoning.alignment.AlignmentScorer;
import com.forecastplatform.reasoning.ensemble.EnsembleReasoner;
import com.forecastplatform.retrieval.RetrievalPipeline;
import com.forecastplatform.retrieval.fetch.MultiSourceRetriever;
import com.forecastplatform.retrieval.query.QueryPlanner;
import com.forecastplatform.retrieval.rank.EmbeddingPreFilter;
import com.forecastplatform.retrieval.rank.RelevanceRanker;
import com.forecastplatform.retrieval.source.DocumentSource;
import com.forecastplatform.retrieval.source.NewscatcherDocumentSource;
import com.forecastplatform.retrieval.summarize.ArticleSummarizer;
import com.forecastplatform.retrieval.summarize.RecursiveSummarizer;
import com.forecastplatform.runner.labeling.QuestionLabeler;
import com.forecastplatform.runner.store.FileSystemResultStore;
import com.forecastplatform.runner.store.ResultStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pipeline components and the immutable run configuration built from {@code forecast.*}.
 *
 * <p>Every configured model name is checked against the {@link ModelCatalog} here, so a
 * typo fails at startup instead of in the middle of a batch.
 */
@Configuration
public class ForecastConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

    // ── retrieval ────────────────────────────────────────────────────────────
    @Value("${forecast.retrieval.num-search-queries:3}")
    private int numSearchQueries;

    @Value("${forecast.retrieval.newscatcher-word-limit:5}")
    private int newscatcherWordLimit;

    @Value("${forecast.retrieval.query-model:gpt-4-1106-preview}")
    private String queryModel;

    @Value("${forecast.retrieval.query-temperature:0.0}")
    private double queryTemperature;

    @Value("${forecast.retrieval.query-templates:search_query_0,search_query_1}")
    private List<String> queryTemplates;

    @Value("${forecast.retrieval.articles-per-query:5}")
    private int articlesPerQuery;

    @Value("${forecast.retrieval.min-article-length:200}")
    private int minArticleLength;

    @Value("${forecast.retrieval.blocked-sites:}")
    private List<String> blockedSites;

    @Value("${forecast.retrieval.pre-filter-enabled:true}")
    private boolean preFilterEnabled;

    @Value("${forecast.retrieval.ranking-method:llm-rating}")
    private String rankingMethod;

    @Value("${forecast.retrieval.rating-detail:title_250_tokens}")
    private String ratingDetail;

    @Value("${forecast.retrieval.ranking-model:gpt-3.5-turbo-1106}")
    private String rankingModel;

    @Value("${forecast.retrieval.ranking-template:relevance_0}")
    private String rankingTemplate;

    @Value("${forecast.retrieval.relevance-threshold:4}")
    private double relevanceThreshold;

    @Value("${forecast.retrieval.sort-by:date}")
    private String sortBy;

    @Value("${forecast.retrieval.summarization-model:gpt-3.5-turbo-1106}")
    private String summarizationModel;

    @Value("${forecast.retrieval.summarization-template:summarization_9}")
    private String summarizationTemplate;

    @Value("${forecast.retrieval.num-summaries:20}")
    private int numSummaries;

    @Value("${forecast.retrieval.concurrency:8}")
    private int retrievalConcurrency;

    // ── reasoning ────────────────────────────────────────────────────────────
    @Value("${forecast.reasoning.base-models:gpt-4-1106-preview,claude-2.1}")
    private List<String> baseModels;

    @Value("${forecast.reasoning.base-templates:base_reasoning_1,base_reasoning_2}")
    private List<String> baseTemplates;

    @Value("${forecast.reasoning.base-temperature:1.0}")
    private double baseTemperature;

    @Value("${forecast.reasoning.answer-type:probability}")
    private String answerType;

    @Value("${forecast.reasoning.vocabulary:ten}")
    private String vocabulary;

    @Value("${forecast.reasoning.aggregation:meta}")
    private String aggregation;

    @Value("${forecast.reasoning.weights:}")
    private List<Double> weights;

    @Value("${forecast.reasoning.meta-model:gpt-4-1106-preview}")
    private String metaModel;

    @Value("${forecast.reasoning.meta-template:meta_reasoning_0}")
    private String metaTemplate;

    @Value("${forecast.reasoning.alignment-model:gpt-3.5-turbo-1106}")
    private String alignmentModel;

    @Value("${forecast.reasoning.alignment-template:alignment_0}")
    private String alignmentTemplate;

    @Value("${forecast.reasoning.concurrency:4}")
    private int reasoningConcurrency;

    // ── labeling / storage ───────────────────────────────────────────────────
    @Value("${forecast.labeling.model:gpt-3.5-turbo-1106}")
    private String labelingModel;

    @Value("${forecast.labeling.threads:10}")
    private int labelingThreads;

    @Bean
    public RetrievalConfig retrievalConfig(PromptLibrary prompts, ModelCatalog modelCatalog) {
        RetrievalConfig config = RetrievalConfig.builder()
            .numSearchQueries(numSearchQueries)
            .sourceWordLimits(Map.of(NewscatcherDocumentSource.SOURCE_ID, newscatcherWordLimit))
            .queryModel(known(modelCatalog, queryModel))
            .queryTemperature(queryTemperature)
            .queryTemplates(prompts.getAll(queryTemplates))
            .articlesPerQuery(articlesPerQuery)
            .minArticleLength(minArticleLength)
            .blockedSites(blockedSites)
            .preFilterEnabled(preFilterEnabled)
            .rankingMethod(RankingMethod.fromValue(rankingMethod))
            .ratingDetail(RatingDetail.fromValue(ratingDetail))
            .rankingModel(known(modelCatalog, rankingModel))
            .rankingTemplate(prompts.get(rankingTemplate))
            .relevanceThreshold(relevanceThreshold)
            .sortBy(SortKey.fromValue(sortBy))
            .summarizationModel(known(modelCatalog, summarizationModel))
            .summarizationTemplate(prompts.get(summarizationTemplate))
            .numSummaries(numSummaries)
            .concurrency(retrievalConcurrency)
            .build()
            .validate();
        log.info("[Config] Retrieval configured. queries={} ranking={} sortBy={} summaries={}",
            numSearchQueries, rankingMethod, sortBy, numSummaries);
        return config;
    }

    @Bean
    public ReasoningConfig reasoningConfig(PromptLibrary prompts, ModelCatalog modelCatalog) {
        List<PromptTemplate> templates = prompts.getAll(baseTemplates);
        List<List<PromptTemplate>> perModel = new ArrayList<>();
        baseModels.forEach(model -> perModel.add(templates));
        AggregationMethod method = AggregationMethod.fromValue(aggregation);

        ReasoningConfig config = ReasoningConfig.builder()
            .baseModels(baseModels.stream().map(model -> known(modelCatalog, model.trim())).toList())
            .baseTemplates(perModel)
            .baseTemperature(baseTemperature)
            .answerType(AnswerType.valueOf(answerType.trim().toUpperCase()))
            .vocabulary(TokenVocabulary.named(vocabulary))
            .aggregationMethod(method)
            .weights(weights)
            .metaModel(method == AggregationMethod.META ? known(modelCatalog, metaModel) : null)
            .metaTemplate(method == AggregationMethod.META ? prompts.get(metaTemplate) : null)
            .alignmentModel(known(modelCatalog, alignmentModel))
            .alignmentTemplate(alignmentTemplate.isBlank() ? null : prompts.get(alignmentTemplate))
            .concurrency(reasoningConcurrency)
            .build()
            .validate();
        log.info("[Config] Reasoning configured. models={} templatesPerModel={} aggregation={} answerType={}",
            baseModels, templates.size(), aggregation, answerType);
        return config;
    }

    @Bean
    public QueryPlanner queryPlanner(CompletionClient completionClient) {
        return new QueryPlanner(completionClient);
    }

    @Bean
    public MultiSourceRetriever multiSourceRetriever(List<DocumentSource> documentSources) {
        return new MultiSourceRetriever(documentSources);
    }

    @Bean
    public EmbeddingPreFilter embeddingPreFilter(EmbeddingProvider embeddingProvider) {
        return new EmbeddingPreFilter(embeddingProvider);
    }

    @Bean
    public RelevanceRanker relevanceRanker(CompletionClient completionClient, EmbeddingProvider embeddingProvider) {
        return new RelevanceRanker(completionClient, embeddingProvider);
    }

    @Bean
    public RecursiveSummarizer recursiveSummarizer(CompletionClient completionClient, ModelCatalog modelCatalog,
                                                   TokenCounter tokenCounter) {
        return new RecursiveSummarizer(completionClient, modelCatalog, tokenCounter);
    }

    @Bean
    public ArticleSummarizer articleSummarizer(RecursiveSummarizer recursiveSummarizer, TokenCounter tokenCounter) {
        return new ArticleSummarizer(recursiveSummarizer, tokenCounter);
    }

    @Bean
    public RetrievalPipeline retrievalPipeline(QueryPlanner queryPlanner, MultiSourceRetriever retriever,
                                               EmbeddingPreFilter preFilter, RelevanceRanker ranker,
                                               ArticleSummarizer summarizer) {
        return new RetrievalPipeline(queryPlanner, retriever, preFilter, ranker, summarizer);
    }

    @Bean
    public EnsembleReasoner ensembleReasoner(CompletionClient completionClient) {
        return new EnsembleReasoner(completionClient);
    }

    @Bean
    public AlignmentScorer alignmentScorer(CompletionClient completionClient) {
        return new AlignmentScorer(completionClient);
    }

    @Bean
    public ResultStore resultStore(ObjectMapper objectMapper) {
        return new FileSystemResultStore(objectMapper);
    }

    @Bean
    public QuestionLabeler questionLabeler(CompletionClient completionClient, PromptLibrary prompts,
                                           ModelCatalog modelCatalog) {
        return new QuestionLabeler(completionClient, known(modelCatalog, labelingModel),
            prompts.get("assign_category"), prompts.get("is_bad_title"), labelingThreads);
    }

    /** Resolves the name through the catalog so unknown models fail with a typed error. */
    private static String known(ModelCatalog catalog, String model) {
        return catalog.lookup(model).name();
    }
}
