package com.forecastplatform.retrieval.source;

import com.forecastplatform.common.model.DateRange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A searchable news corpus.
 *
 * <p>Implementations return hits ranked by the corpus's own relevance ordering, at most
 * {@code maxResults} of them. Failures are signalled as errors; the retriever decides
 * whether to skip them.
 */
public interface DocumentSource {

    /** Identifier used in configuration and on retrieved articles. */
    String id();

    Mono<List<RawDocument>> search(String query, DateRange range, int maxResults);
}
