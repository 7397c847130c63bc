package com.forecastplatform.gateway;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Text-embedding capability. Emits one vector per input text, in input order.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    Mono<List<double[]>> embed(List<String> texts);
}
