package com.kaspagateway.cache;

import java.util.Map;

/**
 * Per-category lookup classification. Injected into {@link TieredCacheService} so tests can substitute their own.
 */
public interface CacheStatsCollector {

    void recordHit(String category);

    void recordMiss(String category);

    /**
     * Consistent copy of all counters; categories are created lazily on first record.
     */
    Map<String, CategoryCounters> snapshot();
}
