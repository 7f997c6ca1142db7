package com.kaspagateway.cache;

import java.util.Map;

/**
 * Aggregate cache statistics served by /v1/api/kaspa/cache/stats.
 */
public record CacheStats(
        long totalKeys,
        long totalSizeBytes,
        int categoriesCount,
        String basePath,
        Map<String, CategoryStats> categories,
        long cacheHits
) {
}
