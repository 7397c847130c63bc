package com.forecastplatform.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.gateway.CompletionProvider;
import com.forecastplatform.gateway.CompletionRequest;
import com.forecastplatform.gateway.ModelSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions adapter for OpenAI and for hosts speaking the same wire format
 * (Together AI). The {@link ModelSource} it registers under is supplied by the caller.
 */
public class OpenAiCompatibleCompletionProvider implements CompletionProvider {

    private final ModelSource source;
    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenAiCompatibleCompletionProvider(ModelSource source, WebClient client,
                                              ObjectMapper objectMapper, String apiKey) {
        this.source = source;
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public ModelSource source() {
        return source;
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ConfigurationException("No API key configured for " + source));
        }
        List<Map<String, String>> messages = new ArrayList<>();
        if (request.systemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt()));

        Map<String, Object> body = Map.of(
            "model", request.model(),
            "messages", messages,
            "max_tokens", request.maxTokens(),
            "temperature", request.temperature()
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        String stage = source.name().toLowerCase();
        try {
            JsonNode choices = objectMapper.readTree(response).path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new ForecastException(stage, "Response has no choices");
            }
            return choices.get(0).path("message").path("content").asText();
        } catch (ForecastException e) {
            throw e;
        } catch (Exception e) {
            throw new ForecastException(stage, "Failed to extract text from response", e);
        }
    }
}
