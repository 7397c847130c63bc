package com.forecastplatform.runner.batch;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.ForecastQuestion;
import com.forecastplatform.runner.config.ProviderConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionFileRunnerTest {

    @TempDir
    Path dir;

    private final QuestionFileRunner runner = new QuestionFileRunner(null, new ProviderConfig().objectMapper());

    @Test
    @DisplayName("questions file is read into questions with dates and resolution")
    void readsQuestions() throws Exception {
        Path file = dir.resolve("questions.json");
        Files.writeString(file, """
            [
              {
                "question": "Will the central bank cut rates by June?",
                "background": "Inflation has eased.",
                "resolutionCriteria": "Resolves YES on any cut.",
                "retrievalRange": {"start": "2024-01-01", "end": "2024-03-01"},
                "closeDate": "2024-06-30",
                "answer": 1.0,
                "communityPrediction": 0.62
              }
            ]
            """);

        List<ForecastQuestion> questions = runner.read(file);

        assertEquals(1, questions.size());
        ForecastQuestion question = questions.get(0);
        assertEquals(LocalDate.of(2024, 3, 1), question.retrievalRange().end());
        assertEquals(LocalDate.of(2024, 6, 30), question.closeDate());
        assertTrue(question.isResolved());
        assertEquals(0.62, question.communityPrediction(), 1e-9);
    }

    @Test
    @DisplayName("missing file is a configuration error")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> runner.read(dir.resolve("absent.json")));
    }
}
