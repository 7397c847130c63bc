package com.forecastplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the id of the question being forecast through a reactive pipeline.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single log
 * statement, so worker threads never leak one question's id into another's log lines.
 *
 * <pre>
 *     return QuestionTrace.withQuestionId(pipeline, questionId);
 * </pre>
 */
public final class QuestionTrace {

    public static final String QUESTION_ID_KEY = "questionId";

    private QuestionTrace() {}

    /** Call at the end of pipeline assembly; {@code contextWrite} propagates upstream. */
    public static <T> Mono<T> withQuestionId(Mono<T> mono, String questionId) {
        return mono.contextWrite(ctx -> ctx.put(QUESTION_ID_KEY, questionId));
    }

    /** Returns {@code "unknown"} when no id was written, never {@code null}. */
    public static String getQuestionId(ContextView ctx) {
        return ctx.getOrDefault(QUESTION_ID_KEY, "unknown");
    }

    public static void withMdc(String questionId, Runnable logAction) {
        MDC.put(QUESTION_ID_KEY, questionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(QUESTION_ID_KEY);
        }
    }
}
