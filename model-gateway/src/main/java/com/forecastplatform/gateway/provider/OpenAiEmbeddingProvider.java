package com.forecastplatform.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.gateway.EmbeddingProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI embeddings adapter. Newlines are flattened to spaces before embedding, and vectors
 * are returned in input order regardless of the order the API lists them in.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    public static final String DEFAULT_MODEL = "text-embedding-3-large";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public OpenAiEmbeddingProvider(WebClient client, ObjectMapper objectMapper, String apiKey, String model) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public Mono<List<double[]>> embed(List<String> texts) {
        if (texts.isEmpty()) return Mono.just(List.of());
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ConfigurationException("No OpenAI API key configured for embeddings"));
        }
        List<String> input = texts.stream().map(t -> t.replace("\n", " ")).toList();
        Map<String, Object> body = Map.of("model", model, "input", input);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/embeddings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(response -> extractVectors(response, texts.size()));
    }

    private List<double[]> extractVectors(String response, int expected) {
        JsonNode data;
        try {
            data = objectMapper.readTree(response).path("data");
        } catch (Exception e) {
            throw new ForecastException("embedding", "Failed to parse embedding response", e);
        }
        if (!data.isArray() || data.size() != expected) {
            throw new ForecastException("embedding", "Expected " + expected + " vectors, got "
                + (data.isArray() ? data.size() : 0));
        }
        List<double[]> vectors = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) vectors.add(null);
        for (JsonNode item : data) {
            JsonNode values = item.path("embedding");
            double[] vector = new double[values.size()];
            for (int j = 0; j < vector.length; j++) vector[j] = values.get(j).asDouble();
            vectors.set(item.path("index").asInt(), vector);
        }
        return vectors;
    }
}
