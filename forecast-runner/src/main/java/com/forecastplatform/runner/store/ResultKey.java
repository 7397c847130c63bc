package com.forecastplatform.runner.store;

import java.nio.file.Path;

/**
 * Location of one stored forecast: {@code {outputDir}/{retrievalIndex}/{questionSlug}.json}.
 */
public record ResultKey(String outputDir, int retrievalIndex, String questionSlug) {

    public static ResultKey of(String outputDir, int retrievalIndex, String question) {
        return new ResultKey(outputDir, retrievalIndex, slug(question));
    }

    /** Spaces become underscores and slashes are dropped. */
    public static String slug(String question) {
        return question.replace(" ", "_").replace("/", "");
    }

    public Path path() {
        return Path.of(outputDir, String.valueOf(retrievalIndex), questionSlug + ".json");
    }

    @Override
    public String toString() {
        return path().toString();
    }
}
