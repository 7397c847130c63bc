package com.forecastplatform.gateway;

import com.forecastplatform.common.exception.UnknownModelException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static registry of known models: which provider serves each one and how large its
 * context window is. Lookups of unregistered names fail with {@link UnknownModelException}.
 *
 * <p>Fine-tuned OpenAI models ({@code ft:gpt...}) resolve without registration.
 */
public class ModelCatalog {

    private static final String FINE_TUNED_PREFIX = "ft:gpt";
    private static final int FINE_TUNED_TOKEN_LIMIT = 16_000;

    private final Map<String, ModelSpec> models;

    public ModelCatalog(Collection<ModelSpec> specs) {
        Map<String, ModelSpec> map = new LinkedHashMap<>();
        for (ModelSpec spec : specs) map.put(spec.name(), spec);
        this.models = Map.copyOf(map);
    }

    public static ModelCatalog defaults() {
        return new ModelCatalog(List.of(
            new ModelSpec("gpt-4", ModelSource.OPENAI, 8_000),
            new ModelSpec("gpt-3.5-turbo-1106", ModelSource.OPENAI, 16_000),
            new ModelSpec("gpt-3.5-turbo-16k", ModelSource.OPENAI, 16_000),
            new ModelSpec("gpt-3.5-turbo", ModelSource.OPENAI, 8_000),
            new ModelSpec("gpt-4-1106-preview", ModelSource.OPENAI, 128_000),
            new ModelSpec("claude-2.1", ModelSource.ANTHROPIC, 200_000),
            new ModelSpec("claude-2", ModelSource.ANTHROPIC, 100_000),
            new ModelSpec("claude-3-opus-20240229", ModelSource.ANTHROPIC, 200_000),
            new ModelSpec("claude-3-sonnet-20240229", ModelSource.ANTHROPIC, 200_000),
            new ModelSpec("gemini-pro", ModelSource.GOOGLE, 30_720),
            new ModelSpec("togethercomputer/llama-2-7b-chat", ModelSource.TOGETHER, 4_096),
            new ModelSpec("togethercomputer/llama-2-13b-chat", ModelSource.TOGETHER, 4_096),
            new ModelSpec("togethercomputer/llama-2-70b-chat", ModelSource.TOGETHER, 4_096),
            new ModelSpec("togethercomputer/LLaMA-2-7B-32K", ModelSource.TOGETHER, 32_768),
            new ModelSpec("togethercomputer/StripedHyena-Nous-7B", ModelSource.TOGETHER, 32_768),
            new ModelSpec("mistralai/Mistral-7B-Instruct-v0.2", ModelSource.TOGETHER, 32_768),
            new ModelSpec("mistralai/Mixtral-8x7B-Instruct-v0.1", ModelSource.TOGETHER, 32_768),
            new ModelSpec("zero-one-ai/Yi-34B-Chat", ModelSource.TOGETHER, 4_096),
            new ModelSpec("NousResearch/Nous-Hermes-2-Mixtral-8x7B-DPO", ModelSource.TOGETHER, 32_768),
            new ModelSpec("NousResearch/Nous-Hermes-2-Yi-34B", ModelSource.TOGETHER, 32_768)
        ));
    }

    public ModelSpec lookup(String modelName) {
        if (modelName == null) throw new UnknownModelException("null");
        ModelSpec spec = models.get(modelName);
        if (spec != null) return spec;
        if (modelName.startsWith(FINE_TUNED_PREFIX)) {
            return new ModelSpec(modelName, ModelSource.OPENAI, FINE_TUNED_TOKEN_LIMIT);
        }
        throw new UnknownModelException(modelName);
    }

    public ModelSource sourceOf(String modelName) {
        return lookup(modelName).source();
    }

    public int tokenLimit(String modelName) {
        return lookup(modelName).tokenLimit();
    }

    public boolean contains(String modelName) {
        return models.containsKey(modelName)
            || (modelName != null && modelName.startsWith(FINE_TUNED_PREFIX));
    }
}
