package com.kaspagateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Cache core configuration. Documented in application.yml under kaspagateway.cache.
 */
@ConfigurationProperties(prefix = "kaspagateway.cache")
@Validated
@Getter
@Setter
public class CacheProperties {

    /**
     * Root directory of the durable store; one sub-directory per category.
     */
    @NotBlank
    private String basePath = "data/cache";

    /**
     * Upstream requests admitted per sliding 60 second window. 0 blocks all upstream calls.
     */
    @Min(0)
    private int requestsPerMinute = 1000;

    /**
     * Collapse concurrent misses on the same key into one upstream fetch.
     */
    private boolean singleFlight = true;

    /**
     * Value written to the "source" field of durable metadata.
     */
    private String source = "kaspa-gateway";

    /**
     * Upper bound of the in-process fast store (used when Redis is disabled).
     */
    @Min(1)
    private long inMemoryMaximumSize = 10_000;

    /** Periodic removal of expired durable entries. */
    private boolean cleanupEnabled = true;

    @Min(1000)
    private long cleanupIntervalMs = 3_600_000;

    @Valid
    private Redis redis = new Redis();

    @Getter
    @Setter
    public static class Redis {
        /** When false the fast store is an in-process Caffeine cache. */
        private boolean enabled = false;
        /** Prefix applied to every fast-store key. */
        private String keyPrefix = "kg:";
    }
}
