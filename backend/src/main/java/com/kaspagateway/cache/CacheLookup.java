package com.kaspagateway.cache;

import java.time.Duration;

/**
 * Identifies one piece of cached data in both tiers: fast-store key, durable category + key, and TTL per tier.
 */
public record CacheLookup(String fastKey, String category, String durableKey, Duration fastTtl, Duration durableTtl) {

    public CacheLookup {
        if (fastKey == null || fastKey.isBlank()) {
            throw new IllegalArgumentException("fastKey is required");
        }
        if (category == null || category.isBlank() || durableKey == null || durableKey.isBlank()) {
            throw new IllegalArgumentException("category and durableKey are required");
        }
        if (fastTtl == null || fastTtl.isZero() || fastTtl.isNegative()
                || durableTtl == null || durableTtl.isZero() || durableTtl.isNegative()) {
            throw new IllegalArgumentException("TTLs must be positive");
        }
        if (fastTtl.compareTo(durableTtl) > 0) {
            throw new IllegalArgumentException("fastTtl " + fastTtl + " exceeds durableTtl " + durableTtl);
        }
    }

    public static CacheLookup of(String fastKey, CacheCategory category, String durableKey, CacheTier tier) {
        return new CacheLookup(fastKey, category.getDirectoryName(), durableKey, tier.getFastTtl(), tier.getDurableTtl());
    }
}
