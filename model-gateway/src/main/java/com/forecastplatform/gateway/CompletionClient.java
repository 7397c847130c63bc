package com.forecastplatform.gateway;

import reactor.core.publisher.Mono;

/**
 * Text-completion capability used by every pipeline stage.
 *
 * <p>Emits the response text, or an error once the implementation has given up retrying.
 */
@FunctionalInterface
public interface CompletionClient {

    Mono<String> complete(CompletionRequest request);

    /**
     * Blocking variant for callers that run on their own worker threads.
     * Must never be called from a reactive pipeline.
     */
    default String completeBlocking(CompletionRequest request) {
        return complete(request).block();
    }
}
