package com.forecastplatform.runner.config;

import com.forecastplatform.gateway.CompletionGateway;
import com.forecastplatform.gateway.CompletionProvider;
import com.forecastplatform.gateway.EmbeddingProvider;
import com.forecastplatform.gateway.ModelCatalog;
import com.forecastplatform.gateway.ModelSource;
import com.forecastplatform.gateway.RetryPolicy;
import com.forecastplatform.gateway.provider.AnthropicCompletionProvider;
import com.forecastplatform.gateway.provider.GoogleCompletionProvider;
import com.forecastplatform.gateway.provider.OpenAiCompatibleCompletionProvider;
import com.forecastplatform.gateway.provider.OpenAiEmbeddingProvider;
import com.forecastplatform.gateway.token.ModelTokenCounter;
import com.forecastplatform.gateway.token.TokenCounter;
import com.forecastplatform.retrieval.source.NewscatcherDocumentSource;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * HTTP clients and provider adapters. API keys default to empty; a provider without a key
 * fails only when a model it serves is actually called.
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Value("${providers.openai.base-url:https://api.openai.com}")
    private String openAiUrl;

    @Value("${providers.openai.api-key:}")
    private String openAiKey;

    @Value("${providers.openai.embedding-model:text-embedding-3-large}")
    private String embeddingModel;

    @Value("${providers.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicUrl;

    @Value("${providers.anthropic.api-key:}")
    private String anthropicKey;

    @Value("${providers.google.base-url:https://generativelanguage.googleapis.com}")
    private String googleUrl;

    @Value("${providers.google.api-key:}")
    private String googleKey;

    @Value("${providers.together.base-url:https://api.together.xyz}")
    private String togetherUrl;

    @Value("${providers.together.api-key:}")
    private String togetherKey;

    @Value("${providers.newscatcher.base-url:https://api.newscatcherapi.com}")
    private String newscatcherUrl;

    @Value("${providers.newscatcher.api-key:}")
    private String newscatcherKey;

    @Value("${providers.retry.delay-seconds:30}")
    private long retryDelaySeconds;

    @Value("${providers.retry.max-attempts:5}")
    private long retryMaxAttempts;

    @Value("${providers.retry.timeout-seconds:120}")
    private long timeoutSeconds;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ModelCatalog modelCatalog() {
        return ModelCatalog.defaults();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(Duration.ofSeconds(retryDelaySeconds), retryMaxAttempts,
            Long.MAX_VALUE, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public TokenCounter tokenCounter(ModelCatalog modelCatalog) {
        return new ModelTokenCounter(modelCatalog);
    }

    @Bean
    public CompletionProvider openAiCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new OpenAiCompatibleCompletionProvider(ModelSource.OPENAI,
            client(builder, openAiUrl), objectMapper, openAiKey);
    }

    @Bean
    public CompletionProvider togetherCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new OpenAiCompatibleCompletionProvider(ModelSource.TOGETHER,
            client(builder, togetherUrl), objectMapper, togetherKey);
    }

    @Bean
    public CompletionProvider anthropicCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        WebClient.Builder anthropicBuilder = builder.clone()
            .defaultHeader("anthropic-version", ANTHROPIC_VERSION);
        return new AnthropicCompletionProvider(client(anthropicBuilder, anthropicUrl), objectMapper, anthropicKey);
    }

    @Bean
    public CompletionProvider googleCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new GoogleCompletionProvider(client(builder, googleUrl), objectMapper, googleKey);
    }

    @Bean
    public CompletionGateway completionGateway(ModelCatalog modelCatalog, List<CompletionProvider> providers,
                                               RetryPolicy retryPolicy) {
        return new CompletionGateway(modelCatalog, providers, retryPolicy);
    }

    @Bean
    public EmbeddingProvider embeddingProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new OpenAiEmbeddingProvider(client(builder, openAiUrl), objectMapper, openAiKey, embeddingModel);
    }

    @Bean
    public NewscatcherDocumentSource newscatcherDocumentSource(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new NewscatcherDocumentSource(client(builder, newscatcherUrl), objectMapper, newscatcherKey);
    }

    private WebClient client(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("key=[^&]+", "key=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
