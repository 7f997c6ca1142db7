package com.kaspagateway.cache.durable;

/**
 * On-disk size of one category: number of payloads and their total bytes.
 */
public record CategoryFootprint(long keys, long sizeBytes) {

    public static final CategoryFootprint EMPTY = new CategoryFootprint(0, 0);
}
