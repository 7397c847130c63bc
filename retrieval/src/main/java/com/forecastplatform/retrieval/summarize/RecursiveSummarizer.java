package com.forecastplatform.retrieval.summarize;

import com.forecastplatform.gateway.CompletionClient;
import com.forecastplatform.gateway.CompletionRequest;
import com.forecastplatform.gateway.ModelCatalog;
import com.forecastplatform.gateway.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Summarizes text of any length with a model whose context window is bounded.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>If the text fits the model's token limit, summarize it in one call.</li>
 *   <li>Otherwise split it into word-aligned chunks of at most {@code limit - margin} tokens,
 *       summarize the chunks concurrently, join the summaries with a space and repeat.</li>
 * </ol>
 *
 * <h3>Termination guards</h3>
 * <ul>
 *   <li>A round whose joined summaries are not shorter than its input stops recursing and
 *       summarizes only the first chunk of the joined text.</li>
 *   <li>After {@code maxDepth} rounds the first chunk is summarized and the rest dropped.</li>
 *   <li>A final summary longer than the limit is cut to its first chunk.</li>
 * </ul>
 */
public class RecursiveSummarizer {

    private static final Logger log = LoggerFactory.getLogger(RecursiveSummarizer.class);

    private final CompletionClient completionClient;
    private final ModelCatalog catalog;
    private final TokenCounter tokenCounter;

    public RecursiveSummarizer(CompletionClient completionClient, ModelCatalog catalog, TokenCounter tokenCounter) {
        this.completionClient = completionClient;
        this.catalog = catalog;
        this.tokenCounter = tokenCounter;
    }

    public Mono<SummaryOutcome> summarize(String text, SummarySettings settings) {
        return Mono.defer(() -> summarize(text, settings, 0));
    }

    private Mono<SummaryOutcome> summarize(String text, SummarySettings settings, int passes) {
        int limit = catalog.tokenLimit(settings.model());
        int tokens = tokenCounter.count(text, settings.model());
        if (tokens <= limit) {
            return callOnce(text, settings).map(summary -> new SummaryOutcome(capped(summary, settings, limit), passes));
        }

        int chunkLimit = chunkLimit(limit, settings.chunkSafetyMargin());
        List<String> chunks = TextChunker.split(text, chunkLimit, settings.model(), tokenCounter);
        if (passes >= settings.maxDepth()) {
            log.warn("[Summarizer] Depth limit reached, summarizing the first chunk only. model={} depth={} chunks={}",
                settings.model(), passes, chunks.size());
            return callOnce(chunks.get(0), settings)
                .map(summary -> new SummaryOutcome(capped(summary, settings, limit), passes));
        }

        log.debug("[Summarizer] Splitting text. model={} tokens={} limit={} chunks={} pass={}",
            settings.model(), tokens, limit, chunks.size(), passes + 1);
        return Flux.fromIterable(chunks)
            .flatMapSequential(chunk -> callOnce(chunk, settings), Math.max(1, settings.concurrency()))
            .collectList()
            .flatMap(parts -> {
                String joined = String.join(" ", parts);
                if (tokenCounter.count(joined, settings.model()) >= tokens) {
                    log.warn("[Summarizer] Summaries did not shrink the text, summarizing the first chunk only. "
                        + "model={} tokens={} pass={}", settings.model(), tokens, passes + 1);
                    String head = TextChunker.split(joined, chunkLimit, settings.model(), tokenCounter).get(0);
                    return callOnce(head, settings)
                        .map(summary -> new SummaryOutcome(capped(summary, settings, limit), passes + 1));
                }
                return summarize(joined, settings, passes + 1);
            });
    }

    private Mono<String> callOnce(String text, SummarySettings settings) {
        return completionClient.complete(
            CompletionRequest.of(settings.model(), settings.prompt(text), settings.temperature()));
    }

    private String capped(String summary, SummarySettings settings, int limit) {
        if (tokenCounter.count(summary, settings.model()) <= limit) return summary;
        log.warn("[Summarizer] Summary exceeds the token limit, truncating. model={} limit={}", settings.model(), limit);
        return TextChunker.split(summary, limit, settings.model(), tokenCounter).get(0);
    }

    static int chunkLimit(int limit, int margin) {
        return limit > margin ? limit - margin : Math.max(1, limit / 2);
    }
}
