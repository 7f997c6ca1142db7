package com.kaspagateway.cache;

/**
 * Durable footprint of a category merged with its live lookup counters.
 */
public record CategoryStats(long keys, long sizeBytes, String description, long hits, long misses, long requests) {
}
