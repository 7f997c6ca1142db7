package com.kaspagateway.cache;

/**
 * Hit/miss counters of one category, captured atomically: {@code hits + misses == requests}.
 */
public record CategoryCounters(long hits, long misses, long requests) {

    public static final CategoryCounters EMPTY = new CategoryCounters(0, 0, 0);
}
