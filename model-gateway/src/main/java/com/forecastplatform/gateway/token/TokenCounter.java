package com.forecastplatform.gateway.token;

/** Counts the tokens a model would see for a given text. */
@FunctionalInterface
public interface TokenCounter {

    int count(String text, String model);
}
