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

import java.util.List;
import java.util.Map;

/** Gemini {@code generateContent} adapter. */
public class GoogleCompletionProvider implements CompletionProvider {

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GoogleCompletionProvider(WebClient client, ObjectMapper objectMapper, String apiKey) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public ModelSource source() {
        return ModelSource.GOOGLE;
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ConfigurationException("No Google API key configured"));
        }
        String text = request.systemPrompt() == null
            ? request.prompt()
            : request.systemPrompt() + "\n\n" + request.prompt();
        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", text)))),
            "generationConfig", Map.of(
                "candidateCount", 1,
                "maxOutputTokens", request.maxTokens(),
                "temperature", request.temperature())
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(bodyJson ->
                client.post()
                    .uri(uri -> uri.path("/v1beta/models/{model}:generateContent")
                        .queryParam("key", apiKey)
                        .build(request.model()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        try {
            JsonNode candidates = objectMapper.readTree(response).path("candidates");
            if (!candidates.isArray() || candidates.isEmpty()) {
                throw new ForecastException("google", "Response has no candidates");
            }
            return candidates.get(0).path("content").path("parts").get(0).path("text").asText();
        } catch (ForecastException e) {
            throw e;
        } catch (Exception e) {
            throw new ForecastException("google", "Failed to extract text from response", e);
        }
    }
}
