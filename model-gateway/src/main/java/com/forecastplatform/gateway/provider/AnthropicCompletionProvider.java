package com.forecastplatform.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.gateway.CompletionProvider;
import com.forecastplatform.gateway.CompletionRequest;
import com.forecastplatform.gateway.ModelSource;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API adapter. Response budgets above {@value #MAX_RESPONSE_TOKENS}
 * tokens are capped, since the API rejects them.
 */
public class AnthropicCompletionProvider implements CompletionProvider {

    static final int MAX_RESPONSE_TOKENS = 4096;
    static final String API_VERSION = "2023-06-01";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    /**
     * @param client WebClient with base URL {@code https://api.anthropic.com}
     */
    public AnthropicCompletionProvider(WebClient client, ObjectMapper objectMapper, String apiKey) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public ModelSource source() {
        return ModelSource.ANTHROPIC;
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ConfigurationException("No Anthropic API key configured"));
        }
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.model());
        body.put("max_tokens", Math.min(request.maxTokens(), MAX_RESPONSE_TOKENS));
        body.put("temperature", request.temperature());
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        if (request.systemPrompt() != null) body.put("system", request.systemPrompt());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("content");
            if (!content.isArray() || content.isEmpty()) {
                throw new ForecastException("anthropic", "Response has no content blocks");
            }
            return content.get(0).path("text").asText();
        } catch (ForecastException e) {
            throw e;
        } catch (Exception e) {
            throw new ForecastException("anthropic", "Failed to extract text from response", e);
        }
    }
}
