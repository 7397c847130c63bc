package com.forecastplatform.gateway;

import reactor.core.publisher.Mono;

/** One provider adapter. Makes a single HTTP attempt; retries belong to {@link CompletionGateway}. */
public interface CompletionProvider {

    ModelSource source();

    Mono<String> complete(CompletionRequest request);
}
