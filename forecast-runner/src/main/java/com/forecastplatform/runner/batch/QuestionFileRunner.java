package com.forecastplatform.runner.batch;

import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.model.ForecastQuestion;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch at startup over the questions in {@code forecast.batch.questions-file},
 * a JSON array of questions.
 */
@Component
@ConditionalOnProperty(name = "forecast.batch.questions-file")
public class QuestionFileRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(QuestionFileRunner.class);

    private final BatchForecastRunner batchRunner;
    private final ObjectMapper objectMapper;

    @Value("${forecast.batch.questions-file}")
    private String questionsFile;

    @Value("${forecast.batch.retrieval-index:0}")
    private int retrievalIndex;

    public QuestionFileRunner(BatchForecastRunner batchRunner, ObjectMapper objectMapper) {
        this.batchRunner  = batchRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<ForecastQuestion> questions = read(Path.of(questionsFile));
        log.info("[Batch] Questions loaded. file={} count={}", questionsFile, questions.size());
        batchRunner.run(questions, retrievalIndex).block();
    }

    List<ForecastQuestion> read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), new TypeReference<List<ForecastQuestion>>() {});
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read questions file " + file, e);
        }
    }
}
