package com.kaspagateway.cache.durable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sidecar record stored next to each durable payload.
 *
 * @param cachedAt   epoch seconds when the payload was written
 * @param source     upstream the payload came from
 * @param ttlSeconds TTL the writer intended; validity is still judged by the reader's max age
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheMetadata(
        @JsonProperty("cached_at") long cachedAt,
        @JsonProperty("source") String source,
        @JsonProperty("ttl_seconds") long ttlSeconds
) {
}
