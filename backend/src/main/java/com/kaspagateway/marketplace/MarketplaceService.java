package com.kaspagateway.marketplace;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.kaspagateway.cache.CacheCategory;
import com.kaspagateway.cache.CacheLookup;
import com.kaspagateway.cache.CacheStats;
import com.kaspagateway.cache.CacheTier;
import com.kaspagateway.cache.TieredCacheService;
import com.kaspagateway.marketplace.client.MarketplaceClient;
import com.kaspagateway.marketplace.config.MarketplaceProperties;
import com.kaspagateway.marketplace.model.FloorPriceEntry;
import com.kaspagateway.marketplace.model.HotMint;
import com.kaspagateway.marketplace.model.KnsListedOrders;
import com.kaspagateway.marketplace.model.TokenInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cache-first access to marketplace data. Each operation maps its arguments to a fast key
 * ({@code kaspa:<kind>:...}), a durable category/key and a freshness tier, then delegates to
 * {@link TieredCacheService}. Tickers are upper-cased before they reach any key.
 */
@Service
@RequiredArgsConstructor
public class MarketplaceService {

    public static final int DEFAULT_SOLD_ORDER_MINUTES = 60;

    private static final TypeReference<List<FloorPriceEntry>> FLOOR_PRICE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<HotMint>> HOT_MINT_LIST = new TypeReference<>() {
    };

    private final TieredCacheService cache;
    private final MarketplaceClient client;
    private final MarketplaceProperties properties;

    public JsonNode getTradeStats(String timeFrame, String ticker) {
        String t = normalize(ticker);
        CacheLookup lookup = CacheLookup.of(
                t == null ? "kaspa:trade_stats:" + timeFrame : "kaspa:trade_stats:" + timeFrame + ":" + t,
                CacheCategory.TRADE_STATS,
                t == null ? timeFrame : timeFrame + "_" + t,
                CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> client.fetchTradeStats(timeFrame, t));
    }

    public List<FloorPriceEntry> getFloorPrices(String ticker) {
        String t = normalize(ticker);
        String key = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:floor_price:" + key, CacheCategory.FLOOR_PRICES, key, CacheTier.HOT);
        return cache.getCached(lookup, FLOOR_PRICE_LIST, () -> client.fetchFloorPrices(t));
    }

    public JsonNode getSoldOrders(String ticker, Integer minutes) {
        String t = normalize(ticker);
        int mins = minutes == null ? DEFAULT_SOLD_ORDER_MINUTES : minutes;
        String scope = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:sold_orders:" + scope + ":" + mins, CacheCategory.ORDERS,
                scope + "_" + mins, CacheTier.HOT);
        return cache.getCachedJson(lookup, () -> client.fetchSoldOrders(t, mins));
    }

    public JsonNode getLastOrderSold() {
        CacheLookup lookup = CacheLookup.of("kaspa:last_order_sold", CacheCategory.ORDERS, "last", CacheTier.HOT);
        return cache.getCachedJson(lookup, client::fetchLastOrderSold);
    }

    public List<HotMint> getHotMints(String timeInterval) {
        CacheLookup lookup = CacheLookup.of("kaspa:hot_mints:" + timeInterval, CacheCategory.HOT_MINTS,
                timeInterval, CacheTier.WARM);
        return cache.getCached(lookup, HOT_MINT_LIST, () -> client.fetchHotMints(timeInterval));
    }

    public TokenInfo getTokenInfo(String ticker) {
        String t = requireTicker(ticker);
        return cache.getCached(tokenInfoLookup(t), TokenInfo.class, () -> client.fetchTokenInfo(t));
    }

    /**
     * Bypasses both tiers and re-fetches token info. Counts against the upstream rate limit.
     */
    public JsonNode refreshTokenInfo(String ticker) {
        String t = requireTicker(ticker);
        return cache.refresh(tokenInfoLookup(t), () -> client.fetchTokenInfo(t));
    }

    public JsonNode getTokenLogos(String ticker) {
        String t = normalize(ticker);
        String key = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:logos:" + key, CacheCategory.LOGOS, key, CacheTier.STATIC);
        return cache.getCachedJson(lookup, () -> client.fetchTokenLogos(t));
    }

    public JsonNode getOpenOrders() {
        CacheLookup lookup = CacheLookup.of("kaspa:open_orders", CacheCategory.ORDERS, "active", CacheTier.HOT);
        return cache.getCachedJson(lookup, client::fetchOpenOrders);
    }

    public JsonNode getHistoricalData(String timeFrame, String ticker) {
        String t = requireTicker(ticker);
        CacheLookup lookup = CacheLookup.of("kaspa:historical:" + t + ":" + timeFrame, CacheCategory.HISTORICAL,
                t + "_" + timeFrame, CacheTier.COLD);
        return cache.getCachedJson(lookup, () -> client.fetchHistoricalData(timeFrame, t));
    }

    public JsonNode getKrc721CollectionInfo(String ticker) {
        String t = requireTicker(ticker);
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:collection:" + t, CacheCategory.KRC721,
                "collection_" + t, CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> client.fetchKrc721CollectionInfo(t));
    }

    public JsonNode getKrc721TradeStats(String timeFrame, String ticker) {
        String t = normalize(ticker);
        CacheLookup lookup = CacheLookup.of(
                t == null ? "kaspa:krc721:stats:" + timeFrame : "kaspa:krc721:stats:" + timeFrame + ":" + t,
                CacheCategory.KRC721,
                t == null ? "stats_" + timeFrame : "stats_" + timeFrame + "_" + t,
                CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> client.fetchKrc721TradeStats(timeFrame, t));
    }

    public JsonNode getKrc721Mints(String ticker) {
        String t = normalize(ticker);
        String scope = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:mints:" + scope, CacheCategory.KRC721,
                "mints_" + scope, CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> client.fetchKrc721Mints(t));
    }

    public JsonNode getKrc721SoldOrders(String ticker, Integer minutes) {
        String t = normalize(ticker);
        int mins = minutes == null ? DEFAULT_SOLD_ORDER_MINUTES : minutes;
        String scope = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:sold:" + scope + ":" + mins, CacheCategory.KRC721,
                "sold_" + scope + "_" + mins, CacheTier.HOT);
        return cache.getCachedJson(lookup, () -> client.fetchKrc721SoldOrders(t, mins));
    }

    public JsonNode getKrc721ListedOrders(String ticker) {
        String t = normalize(ticker);
        String scope = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:listed:" + scope, CacheCategory.KRC721,
                "listed_" + scope, CacheTier.HOT);
        return cache.getCachedJson(lookup, () -> client.fetchKrc721ListedOrders(t));
    }

    public List<HotMint> getKrc721HotMints(String timeInterval) {
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:hot_mints:" + timeInterval, CacheCategory.KRC721,
                "hot_mints_" + timeInterval, CacheTier.WARM);
        return cache.getCached(lookup, HOT_MINT_LIST, () -> client.fetchKrc721HotMints(timeInterval));
    }

    public List<FloorPriceEntry> getKrc721FloorPrices(String ticker) {
        String t = normalize(ticker);
        String scope = t == null ? "all" : t;
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:floor:" + scope, CacheCategory.KRC721,
                "floor_" + scope, CacheTier.HOT);
        return cache.getCached(lookup, FLOOR_PRICE_LIST, () -> client.fetchKrc721FloorPrices(t));
    }

    /**
     * Filtered token search. Filters vary too much to be worth caching, so this goes straight to the marketplace.
     */
    public JsonNode getKrc721Tokens(JsonNode filter) {
        return client.fetchKrc721Tokens(filter);
    }

    /**
     * Token metadata rarely changes and is kept on the COLD tier.
     */
    public JsonNode getNftMetadata(String ticker, long tokenId) {
        String t = requireTicker(ticker);
        CacheLookup lookup = CacheLookup.of("kaspa:krc721:metadata:" + t + ":" + tokenId, CacheCategory.KRC721,
                "metadata_" + t + "_" + tokenId, CacheTier.COLD);
        return cache.getCachedJson(lookup, () -> client.fetchNftMetadata(t, tokenId));
    }

    public String getNftImageUrl(String ticker, long tokenId) {
        return client.nftImageUrl(requireTicker(ticker), tokenId);
    }

    public JsonNode getKnsSoldOrders(Integer minutes) {
        int mins = minutes == null ? DEFAULT_SOLD_ORDER_MINUTES : minutes;
        CacheLookup lookup = CacheLookup.of("kaspa:kns:sold:" + mins, CacheCategory.KNS, "sold_" + mins, CacheTier.HOT);
        return cache.getCachedJson(lookup, () -> client.fetchKnsSoldOrders(mins));
    }

    /**
     * Listed domains, unwrapped from the upstream {@code {"orders": [...]}} envelope.
     */
    public List<JsonNode> getKnsListedOrders() {
        CacheLookup lookup = CacheLookup.of("kaspa:kns:listed", CacheCategory.KNS, "listed", CacheTier.HOT);
        KnsListedOrders listed = cache.getCached(lookup, KnsListedOrders.class, client::fetchKnsListedOrders);
        return listed.orders() == null ? List.of() : listed.orders();
    }

    public JsonNode getKnsTradeStats(String timeFrame, String asset) {
        String a = asset == null || asset.isBlank() ? null : asset.strip();
        CacheLookup lookup = CacheLookup.of(
                a == null ? "kaspa:kns:stats:" + timeFrame : "kaspa:kns:stats:" + timeFrame + ":" + a,
                CacheCategory.KNS,
                a == null ? "stats_" + timeFrame : "stats_" + timeFrame + "_" + a,
                CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> client.fetchKnsTradeStats(timeFrame, a));
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public List<String> getConfiguredTokens() {
        return List.copyOf(properties.getTokens().keySet());
    }

    /**
     * Exchanges listing the token. Exact key match first, then case-insensitive.
     */
    public Optional<List<String>> getTokenExchanges(String token) {
        Map<String, List<String>> tokens = properties.getTokens();
        List<String> exact = tokens.get(token);
        if (exact != null) {
            return Optional.of(exact);
        }
        return tokens.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(token))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static CacheLookup tokenInfoLookup(String ticker) {
        return CacheLookup.of("kaspa:token_info:" + ticker, CacheCategory.TOKEN_INFO, ticker, CacheTier.COLD);
    }

    private static String normalize(String ticker) {
        return ticker == null || ticker.isBlank() ? null : MarketplaceClient.normalizeTicker(ticker);
    }

    private static String requireTicker(String ticker) {
        String t = normalize(ticker);
        if (t == null) {
            throw new IllegalArgumentException("ticker is required");
        }
        return t;
    }
}
