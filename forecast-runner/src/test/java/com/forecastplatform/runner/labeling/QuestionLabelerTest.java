package com.forecastplatform.runner.labeling;

import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.common.prompt.PromptTemplate;
import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.runner.RunnerFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QuestionLabelerTest {

    private static final PromptTemplate CATEGORY = new PromptTemplate("assign_category_test", "Category for: {question}");
    private static final PromptTemplate TITLE = new PromptTemplate("is_bad_title_test", "Title check: {question}");

    @Nested
    @DisplayName("category parsing")
    class CategoryTests {

        @Test
        @DisplayName("exact answer, ignoring quotes and case")
        void exact() {
            assertEquals("Sports", QuestionLabeler.parseCategory("'sports'"));
        }

        @Test
        @DisplayName("category named inside a sentence")
        void embedded() {
            assertEquals("Politics & Governance",
                QuestionLabeler.parseCategory("This is about Politics & Governance."));
        }

        @Test
        @DisplayName("unknown answer falls back to Other")
        void fallback() {
            assertEquals("Other", QuestionLabeler.parseCategory("Astrology"));
        }
    }

    @Nested
    @DisplayName("ill-defined parsing")
    class IllDefinedTests {

        @Test
        void ok() {
            assertEquals(Optional.of(false), QuestionLabeler.parseIllDefined("Thinking: fine\nClassification:\nok"));
        }

        @Test
        void flag() {
            assertEquals(Optional.of(true), QuestionLabeler.parseIllDefined("Thinking: vague\nClassification: flag"));
        }

        @Test
        @DisplayName("ambiguous answer counts as ill-defined")
        void ambiguous() {
            assertEquals(Optional.of(true), QuestionLabeler.parseIllDefined("Classification: unsure"));
        }

        @Test
        @DisplayName("missing marker is undetermined")
        void missingMarker() {
            assertEquals(Optional.empty(), QuestionLabeler.parseIllDefined("ok"));
        }
    }

    @Test
    @DisplayName("labels come back in input order; a failed question is left unlabeled")
    void labelsBatch() {
        AtomicInteger calls = new AtomicInteger();
        CompletionClient client = request -> {
            calls.incrementAndGet();
            String prompt = request.prompt();
            if (prompt.contains("broken")) return Mono.error(new IllegalStateException("HTTP 500"));
            if (prompt.startsWith("Category for:")) {
                return Mono.just(prompt.contains("election") ? "Politics & Governance" : "Sports");
            }
            return Mono.just(prompt.contains("Heads or tails") ? "Classification: flag" : "Classification: ok");
        };
        List<ForecastQuestion> questions = List.of(
            RunnerFixtures.question("Will the election be postponed?"),
            RunnerFixtures.question("Will the broken question resolve?"),
            RunnerFixtures.question("Heads or tails"),
            RunnerFixtures.question("Will the cup final go to penalties?"));

        List<QuestionLabel> labels = new QuestionLabeler(client, "gpt-3.5-turbo-1106", CATEGORY, TITLE, 3)
            .label(questions);

        assertEquals(4, labels.size());
        assertEquals(new QuestionLabel("Will the election be postponed?", "Politics & Governance", false), labels.get(0));
        assertEquals(new QuestionLabel("Will the broken question resolve?", null, null), labels.get(1));
        assertEquals(new QuestionLabel("Heads or tails", "Sports", true), labels.get(2));
        assertEquals("Sports", labels.get(3).category());
        assertFalse(labels.get(3).illDefined());
        assertTrue(calls.get() >= 7);
    }
}
