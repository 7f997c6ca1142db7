package com.kaspagateway.marketplace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Marketplace upstream configuration. Documented in application.yml under kaspagateway.marketplace.
 */
@ConfigurationProperties(prefix = "kaspagateway.marketplace")
@Getter
@Setter
public class MarketplaceProperties {

    /**
     * Marketplace API base URL.
     */
    private String baseUrl = "https://api.kaspa.com";

    /**
     * Per-attempt timeout in seconds.
     */
    private int timeoutSeconds = 30;

    /** Retries after the first failed attempt (5xx, 429, connection errors, timeouts). */
    private int maxRetries = 3;

    /** Base delay of the exponential backoff in milliseconds. */
    private long retryBaseDelayMs = 100;

    /**
     * Host serving KRC721 token metadata and optimized images.
     */
    private String metadataBaseUrl = "https://cache.krc721.stream";

    /**
     * Tokens served by the gateway, each with the exchanges that list it. Keys keep their configured case.
     */
    private Map<String, List<String>> tokens = new LinkedHashMap<>();
}
