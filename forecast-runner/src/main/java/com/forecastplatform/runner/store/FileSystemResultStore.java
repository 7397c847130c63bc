package com.forecastplatform.runner.store;

import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.runner.model.ForecastRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes each record as pretty-printed JSON under its key's path. */
public class FileSystemResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemResultStore.class);

    private final ObjectMapper objectMapper;

    public FileSystemResultStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean exists(ResultKey key) {
        return Files.exists(key.path());
    }

    @Override
    public void save(ResultKey key, ForecastRecord record) {
        Path file = key.path();
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), record);
            log.info("[ResultStore] Record saved. path={} finalProbability={}", file, record.finalProbability());
        } catch (IOException e) {
            throw new ForecastException("store", "Failed to write " + file, e);
        }
    }
}
