package com.kaspagateway.common;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter for upstream HTTP calls. The marketplace client retries 3 times starting at 100ms.
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(Duration baseDelay, double jitterFactor, int maxRetries) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        this.baseDelay = baseDelay;
        this.jitterFactor = jitterFactor;
        this.maxRetries = Math.max(0, maxRetries);
    }

    /**
     * Reactor retry spec with the same backoff, limited to errors matching {@code retryable}.
     */
    public RetryBackoffSpec toReactorRetry(Predicate<Throwable> retryable) {
        return Retry.backoff(maxRetries, baseDelay)
                .jitter(jitterFactor)
                .filter(retryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
