package com.forecastplatform.gateway;

/**
 * Catalog entry for one model.
 *
 * @param name       model name as sent to the provider
 * @param source     provider family
 * @param tokenLimit context window in tokens
 */
public record ModelSpec(String name, ModelSource source, int tokenLimit) {}
