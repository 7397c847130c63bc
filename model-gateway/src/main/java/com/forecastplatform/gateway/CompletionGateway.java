package com.forecastplatform.gateway;

import com.forecastplatform.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Routes completion requests to the provider that serves the requested model.
 *
 * <p>The model is resolved through the {@link ModelCatalog} before anything is sent, so an
 * unknown model fails immediately with {@link com.forecastplatform.common.exception.UnknownModelException}.
 * Each provider attempt is bounded by the policy's timeout, and failed attempts are retried
 * with a fixed delay.
 */
public class CompletionGateway implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(CompletionGateway.class);

    private final ModelCatalog catalog;
    private final Map<ModelSource, CompletionProvider> providers = new EnumMap<>(ModelSource.class);
    private final RetryPolicy retryPolicy;

    public CompletionGateway(ModelCatalog catalog, Collection<CompletionProvider> providers, RetryPolicy retryPolicy) {
        this.catalog = catalog;
        this.retryPolicy = retryPolicy;
        for (CompletionProvider provider : providers) {
            this.providers.put(provider.source(), provider);
        }
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        return dispatch(request, retryPolicy.batchRetry());
    }

    @Override
    public String completeBlocking(CompletionRequest request) {
        return dispatch(request, retryPolicy.singleCallRetry()).block();
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    private Mono<String> dispatch(CompletionRequest request, RetryBackoffSpec retry) {
        ModelSource source = catalog.sourceOf(request.model());
        CompletionProvider provider = providers.get(source);
        if (provider == null) {
            throw new ConfigurationException("No completion provider registered for source " + source
                + " (model " + request.model() + ")");
        }
        return Mono.defer(() -> provider.complete(request))
            .timeout(retryPolicy.timeout())
            .retryWhen(retry.doBeforeRetry(signal ->
                log.warn("[Gateway] Completion attempt failed, retrying. model={} attempt={} reason={}",
                    request.model(), signal.totalRetries() + 1, signal.failure().getMessage())))
            .doOnError(e -> log.error("[Gateway] Completion failed. model={} reason={}",
                request.model(), e.getMessage()));
    }
}
