package com.forecastplatform.retrieval;

import com.forecastplatform.common.model.Article;
import com.forecastplatform.retrieval.query.QueryPlan;
import com.forecastplatform.retrieval.summarize.EvidenceDigest;

import java.util.List;
import java.util.Map;

/**
 * Everything one retrieval run produced, kept for inspection and persistence.
 *
 * @param queryPlan   queries sent per source
 * @param retrieved   deduplicated articles before filtering
 * @param preFiltered whether the embedding pre-filter was applied
 * @param ranked      articles that passed the relevance threshold, sorted
 * @param summarized  top ranked articles with summaries, in rank order
 * @param digest      rendered evidence block handed to the forecasters
 */
public record RetrievalOutcome(
    QueryPlan queryPlan,
    List<Article> retrieved,
    boolean preFiltered,
    List<Article> ranked,
    List<Article> summarized,
    String digest
) {

    /** Outcome of a run that made no external call. */
    public static RetrievalOutcome empty() {
        return new RetrievalOutcome(new QueryPlan(Map.of()), List.of(), false, List.of(), List.of(),
            EvidenceDigest.EMPTY);
    }
}
