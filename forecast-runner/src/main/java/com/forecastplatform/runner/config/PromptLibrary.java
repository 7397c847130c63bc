package com.forecastplatform.runner.config;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.prompt.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from {@code prompts/{id}.txt} on the classpath.
 *
 * <p>Templates are never defaulted: every component receives the templates it needs through
 * its config record, and an unknown id fails at startup.
 */
@Component
public class PromptLibrary {

    private static final Logger log = LoggerFactory.getLogger(PromptLibrary.class);
    private static final String PROMPT_DIR = "prompts/";

    private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

    public PromptTemplate get(String id) {
        return cache.computeIfAbsent(id, this::load);
    }

    public List<PromptTemplate> getAll(List<String> ids) {
        return ids.stream().map(String::trim).map(this::get).toList();
    }

    private PromptTemplate load(String id) {
        ClassPathResource resource = new ClassPathResource(PROMPT_DIR + id + ".txt");
        if (!resource.exists()) {
            throw new ConfigurationException("Prompt template not found: " + id);
        }
        try (InputStream in = resource.getInputStream()) {
            String text = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("[Prompts] Template loaded. id={} chars={}", id, text.length());
            return new PromptTemplate(id, text);
        } catch (IOException e) {
            throw new ConfigurationException("Prompt template unreadable: " + id, e);
        }
    }
}
