package com.forecastplatform.gateway;

import com.forecastplatform.common.exception.ConfigurationException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Fixed-delay retry settings for provider calls.
 *
 * <p>Reactive batch call sites get {@code batchMaxAttempts} retries. Blocking single-call
 * sites get {@code singleCallMaxAttempts}, which may be {@link Long#MAX_VALUE} to retry
 * until the provider answers. Configuration errors are never retried.
 *
 * @param delay                 pause between attempts
 * @param batchMaxAttempts      retries for reactive call sites
 * @param singleCallMaxAttempts retries for blocking call sites
 * @param timeout               per-attempt timeout
 */
public record RetryPolicy(
    Duration delay,
    long batchMaxAttempts,
    long singleCallMaxAttempts,
    Duration timeout
) {

    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(30), 5, Long.MAX_VALUE, Duration.ofSeconds(120));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(Duration.ZERO, 0, 0, Duration.ofSeconds(120));
    }

    public RetryBackoffSpec batchRetry() {
        return spec(batchMaxAttempts);
    }

    public RetryBackoffSpec singleCallRetry() {
        return spec(singleCallMaxAttempts);
    }

    private RetryBackoffSpec spec(long attempts) {
        return Retry.fixedDelay(attempts, delay)
            .filter(e -> !(e instanceof ConfigurationException))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
