package com.forecastplatform.runner.store;

import com.forecastplatform.common.model.TokenVocabulary;
import com.forecastplatform.runner.RunnerFixtures;
import com.forecastplatform.runner.config.ProviderConfig;
import com.forecastplatform.runner.model.ForecastRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemResultStoreTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper objectMapper = new ProviderConfig().objectMapper();

    @Test
    @DisplayName("saved record is readable JSON and the key then exists")
    void saveThenExists() throws Exception {
        FileSystemResultStore store = new FileSystemResultStore(objectMapper);
        ResultKey key = ResultKey.of(outputDir.toString(), 1, "Will rates fall");
        ForecastRecord record = ForecastRecord.assemble(RunnerFixtures.question("Will rates fall"), 1,
            RunnerFixtures.retrievalOutcome(), RunnerFixtures.ensemble(0.2, 0.6), List.of(),
            TokenVocabulary.TEN_OPTIONS, Instant.parse("2024-03-02T10:15:30Z"));

        assertFalse(store.exists(key));
        store.save(key, record);

        assertTrue(store.exists(key));
        assertTrue(Files.exists(outputDir.resolve("1").resolve("Will_rates_fall.json")));
        JsonNode json = objectMapper.readTree(key.path().toFile());
        assertEquals("Will rates fall", json.path("question").path("question").asText());
        assertEquals(0.4, json.path("finalProbability").asDouble(), 1e-9);
        assertEquals("2024-03-02T10:15:30Z", json.path("createdAt").asText());
        assertEquals("2024-02-01", json.path("summarizedArticles").get(0).path("publishDate").asText());
        assertEquals("central bank rates", json.path("searchQueries").path("newscatcher").get(0).asText());
    }
}
