package com.forecastplatform.common.prompt;

import com.forecastplatform.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptTemplateTest {

    @Test
    @DisplayName("placeholders are substituted and doubled braces unescaped")
    void rendersPlaceholdersAndEscapes() {
        PromptTemplate template = new PromptTemplate("t", "Q: {question}\nFormat: {{\"rating\": n}}");
        assertEquals("Q: Will it rain?\nFormat: {\"rating\": n}",
            template.render(Map.of("question", "Will it rain?")));
    }

    @Test
    @DisplayName("missing value → ConfigurationException naming the slot")
    void missingValue() {
        PromptTemplate template = new PromptTemplate("t", "{question} by {date_end}");
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> template.render(Map.of("question", "q")));
        assertTrue(e.getMessage().contains("{date_end}"));
    }

    @Test
    @DisplayName("placeholders() lists slots in first-use order")
    void listsPlaceholders() {
        PromptTemplate template = new PromptTemplate("t", "{a} {b} {{c}} {a}");
        assertEquals(Set.of("a", "b"), template.placeholders());
    }

    @Test
    @DisplayName("lone brace is copied through")
    void loneBrace() {
        PromptTemplate template = new PromptTemplate("t", "set { x } and {question}");
        assertEquals("set { x } and q", template.render(Map.of("question", "q")));
    }
}
