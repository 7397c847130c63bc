package com.forecastplatform.runner.config;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.prompt.PromptTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptLibraryTest {

    private final PromptLibrary library = new PromptLibrary();

    private static Map<String, Object> questionValues() {
        Map<String, Object> values = new HashMap<>();
        values.put(PromptTemplate.QUESTION, "Will the central bank cut rates by June?");
        values.put(PromptTemplate.BACKGROUND, "Inflation has eased.");
        values.put(PromptTemplate.RESOLUTION_CRITERIA, "Resolves YES on any cut.");
        return values;
    }

    @Test
    @DisplayName("search query prompts render and ask for the marker the parser reads")
    void searchQueryPrompts() {
        Map<String, Object> values = questionValues();
        values.put(PromptTemplate.DATE_BEGIN, "2024-01-01");
        values.put(PromptTemplate.DATE_END, "2024-03-01");
        values.put(PromptTemplate.NUM_KEYWORDS, 3);
        values.put(PromptTemplate.MAX_WORDS, 5);

        for (PromptTemplate template : library.getAll(List.of("search_query_0", " search_query_1"))) {
            String prompt = template.render(values);
            assertTrue(prompt.contains("Search Queries:"), template.id());
            assertTrue(prompt.contains("exactly 3 queries"), template.id());
            assertFalse(prompt.contains("{{"), template.id());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"base_reasoning_1", "base_reasoning_2", "meta_reasoning_0"})
    @DisplayName("reasoning prompts render with the question, window and digest")
    void reasoningPrompts(String id) {
        Map<String, Object> values = questionValues();
        values.put(PromptTemplate.DATE_BEGIN, "2024-03-01");
        values.put(PromptTemplate.DATE_END, "2024-06-30");
        values.put(PromptTemplate.RETRIEVED_INFO, "---\nARTICLES\n----");
        values.put(PromptTemplate.BASE_REASONINGS, "---\nResponse from forecaster 1:\nx\n---");

        String prompt = library.get(id).render(values);

        assertTrue(prompt.contains("2024-06-30"));
        assertTrue(prompt.contains("ARTICLES"));
    }

    @Test
    @DisplayName("rating prompts ask for the rating marker")
    void ratingPrompts() {
        Map<String, Object> values = questionValues();
        values.put(PromptTemplate.ARTICLE, "Rates hold\nBody");
        values.put(PromptTemplate.REASONING, "Reasons... *0.3*");

        assertTrue(library.get("relevance_0").render(values).contains("Rating:"));
        assertTrue(library.get("alignment_0").render(values).contains("Rating:"));
        assertTrue(library.get("summarization_9").render(values).contains("Rates hold"));
        assertTrue(library.get("is_bad_title").render(values).contains("Classification:"));
        assertTrue(library.get("assign_category").render(values).contains("Security & Defense"));
    }

    @Test
    @DisplayName("same template instance is returned on repeat lookups")
    void cached() {
        assertSame(library.get("relevance_0"), library.get("relevance_0"));
    }

    @Test
    @DisplayName("unknown template id fails with a configuration error")
    void unknownTemplate() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> library.get("does_not_exist"));
        assertTrue(e.getMessage().contains("does_not_exist"));
    }
}
