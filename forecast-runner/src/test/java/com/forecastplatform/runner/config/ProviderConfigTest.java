package com.forecastplatform.runner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.gateway.CompletionProvider;
import com.forecastplatform.gateway.CompletionRequest;
import com.forecastplatform.gateway.EmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ProviderConfigTest {

    private final ProviderConfig config = new ProviderConfig();
    private final ObjectMapper objectMapper = config.objectMapper();
    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(config, "openAiUrl", "http://openai.test");
        ReflectionTestUtils.setField(config, "openAiKey", "oa-key");
        ReflectionTestUtils.setField(config, "embeddingModel", "text-embedding-3-large");
        ReflectionTestUtils.setField(config, "anthropicUrl", "http://anthropic.test");
        ReflectionTestUtils.setField(config, "anthropicKey", "an-key");
        ReflectionTestUtils.setField(config, "timeoutSeconds", 5L);
    }

    private WebClient.Builder respondingWith(String json) {
        return WebClient.builder().exchangeFunction(request -> {
            captured.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
        });
    }

    @Test
    @DisplayName("Anthropic client sends JSON with the anthropic-version header")
    void anthropicHeaders() {
        CompletionProvider provider = config.anthropicCompletionProvider(
            respondingWith("{\"content\":[{\"type\":\"text\",\"text\":\"Likely\"}]}"), objectMapper);

        StepVerifier.create(provider.complete(CompletionRequest.of("claude-2.1", "q", 0.0)))
            .expectNext("Likely")
            .verifyComplete();
        assertEquals(MediaType.APPLICATION_JSON, captured.get().headers().getContentType());
        assertEquals("2023-06-01", captured.get().headers().getFirst("anthropic-version"));
        assertEquals("anthropic.test", captured.get().url().getHost());
    }

    @Test
    @DisplayName("OpenAI client sends JSON without the Anthropic header")
    void openAiHeaders() {
        CompletionProvider provider = config.openAiCompletionProvider(
            respondingWith("{\"choices\":[{\"message\":{\"content\":\"*0.3*\"}}]}"), objectMapper);

        StepVerifier.create(provider.complete(CompletionRequest.of("gpt-4-1106-preview", "q", 0.0)))
            .expectNext("*0.3*")
            .verifyComplete();
        assertEquals(MediaType.APPLICATION_JSON, captured.get().headers().getContentType());
        assertNull(captured.get().headers().getFirst("anthropic-version"));
        assertEquals("Bearer oa-key", captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("embedding client sends JSON")
    void embeddingHeaders() {
        EmbeddingProvider provider = config.embeddingProvider(
            respondingWith("{\"data\":[{\"index\":0,\"embedding\":[1.0,0.0]}]}"), objectMapper);

        StepVerifier.create(provider.embed(List.of("text")))
            .assertNext(vectors -> assertEquals(1, vectors.size()))
            .verifyComplete();
        assertEquals(MediaType.APPLICATION_JSON, captured.get().headers().getContentType());
    }
}
