package com.kaspagateway.cache;

import lombok.Getter;

/**
 * Remote call suppressed because the admission window is full. Retryable by the end caller.
 */
@Getter
public class RateLimitExceededException extends GatewayCacheException {

    private final int limit;

    public RateLimitExceededException(int limit) {
        super("RATE_LIMIT_EXCEEDED",
                "Rate limit exceeded: " + limit + " requests/minute limit reached. Please wait before retrying.",
                null);
        this.limit = limit;
    }
}
