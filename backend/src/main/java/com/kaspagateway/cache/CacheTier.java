package com.kaspagateway.cache;

import java.time.Duration;

/**
 * TTL pairs applied together to a class of cached data. The fast copy always expires no later than the durable copy,
 * so a fast-store expiry is usually answered from disk rather than from the remote API.
 */
public enum CacheTier {

    /** Floor prices, recent orders. */
    HOT(Duration.ofSeconds(30), Duration.ofSeconds(300)),
    /** Trade stats, hot mints. */
    WARM(Duration.ofSeconds(300), Duration.ofSeconds(900)),
    /** Token info, historical data. */
    COLD(Duration.ofSeconds(1800), Duration.ofSeconds(3600)),
    /** Token logos. */
    STATIC(Duration.ofSeconds(3600), Duration.ofSeconds(86400));

    private final Duration fastTtl;
    private final Duration durableTtl;

    CacheTier(Duration fastTtl, Duration durableTtl) {
        if (fastTtl.compareTo(durableTtl) > 0) {
            throw new IllegalStateException("fast TTL must not exceed durable TTL for " + name());
        }
        this.fastTtl = fastTtl;
        this.durableTtl = durableTtl;
    }

    public Duration getFastTtl() {
        return fastTtl;
    }

    public Duration getDurableTtl() {
        return durableTtl;
    }
}
