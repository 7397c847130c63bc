package com.forecastplatform.runner.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome counts of one batch run. {@code failedQuestions} keeps input order.
 */
public record BatchReport(int succeeded, int skipped, List<String> failedQuestions) {

    public BatchReport {
        failedQuestions = List.copyOf(failedQuestions);
    }

    public static BatchReport empty() {
        return new BatchReport(0, 0, List.of());
    }

    public int failed() {
        return failedQuestions.size();
    }

    public int total() {
        return succeeded + skipped + failed();
    }

    BatchReport add(QuestionOutcome outcome) {
        return switch (outcome.status()) {
            case SUCCEEDED -> new BatchReport(succeeded + 1, skipped, failedQuestions);
            case SKIPPED -> new BatchReport(succeeded, skipped + 1, failedQuestions);
            case FAILED -> {
                List<String> failed = new ArrayList<>(failedQuestions);
                failed.add(outcome.question());
                yield new BatchReport(succeeded, skipped, failed);
            }
        };
    }

    enum Status { SUCCEEDED, SKIPPED, FAILED }

    record QuestionOutcome(String question, Status status) {}
}
