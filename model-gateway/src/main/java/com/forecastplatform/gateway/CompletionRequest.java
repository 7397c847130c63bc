package com.forecastplatform.gateway;

/**
 * One text-completion call.
 *
 * @param model        catalog model name
 * @param prompt       user message
 * @param systemPrompt optional system message, {@code null} for none
 * @param maxTokens    response token budget
 * @param temperature  sampling temperature
 */
public record CompletionRequest(
    String model,
    String prompt,
    String systemPrompt,
    int maxTokens,
    double temperature
) {

    public static final int DEFAULT_MAX_TOKENS = 2000;

    public static CompletionRequest of(String model, String prompt, double temperature) {
        return new CompletionRequest(model, prompt, null, DEFAULT_MAX_TOKENS, temperature);
    }

    public CompletionRequest withMaxTokens(int tokens) {
        return new CompletionRequest(model, prompt, systemPrompt, tokens, temperature);
    }
}
