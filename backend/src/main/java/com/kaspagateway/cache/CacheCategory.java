package com.kaspagateway.cache;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of durable-store partitions. The directory name doubles as the statistics bucket.
 */
public enum CacheCategory {

    TOKEN_INFO("tokens", "Token Information (Supply, Market Cap)", CacheTier.COLD),
    TRADE_STATS("trade_stats", "Trade Statistics (Volume, High/Low)", CacheTier.WARM),
    FLOOR_PRICES("floor_prices", "Floor Prices", CacheTier.HOT),
    HISTORICAL("historical", "Historical Data (OHLCV)", CacheTier.COLD),
    ORDERS("orders", "Market Orders", CacheTier.HOT),
    HOT_MINTS("hot_mints", "Trending Mints", CacheTier.WARM),
    LOGOS("logos", "Token Images", CacheTier.STATIC),
    KRC721("krc721", "NFT Collections & Metadata", CacheTier.COLD),
    KNS("kns", "Kaspa Name Service", CacheTier.WARM),
    CONTENT("content", "Repository Content", CacheTier.WARM);

    private final String directoryName;
    private final String description;
    private final CacheTier longestTier;

    CacheCategory(String directoryName, String description, CacheTier longestTier) {
        this.directoryName = directoryName;
        this.description = description;
        this.longestTier = longestTier;
    }

    /**
     * Durable TTL of the longest-lived tier written into this category. Entries older than this are never served.
     */
    public Duration getRetention() {
        return longestTier.getDurableTtl();
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<CacheCategory> fromDirectoryName(String name) {
        return Arrays.stream(values())
                .filter(c -> c.directoryName.equals(name))
                .findFirst();
    }

    /**
     * Description for a category name; unknown names are described as ad-hoc activity buckets.
     */
    public static String describe(String name) {
        return fromDirectoryName(name)
                .map(CacheCategory::getDescription)
                .orElse(name + " (cache activity)");
    }
}
