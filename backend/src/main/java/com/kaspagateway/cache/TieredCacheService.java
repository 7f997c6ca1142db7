package com.kaspagateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaspagateway.cache.durable.CategoryFootprint;
import com.kaspagateway.cache.durable.DurableStore;
import com.kaspagateway.cache.faststore.FastStore;
import com.kaspagateway.common.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tiered lookup over the fast store (hot), the durable store (warm/cold) and the rate-limited remote source.
 *
 * <p>Lookup order for {@code getCached}/{@code getCachedJson}:
 * <ol>
 *   <li>Fast store by fast key. An undecodable value is a miss at this tier.</li>
 *   <li>Durable store, if the entry is valid for the durable TTL. A read fault is a miss at this tier.
 *       On a hit the fast store is repopulated (best effort).</li>
 *   <li>Rate limiter admission, then the caller's fetcher. The fetched value must deserialize into the requested
 *       shape before it is written back to both tiers (best effort).</li>
 * </ol>
 * Every lookup is classified as exactly one hit or miss for its category.
 *
 * <p>With single flight enabled, concurrent misses on the same fast key share one admission and one fetch.
 */
@Slf4j
public class TieredCacheService {

    private final FastStore fastStore;
    private final DurableStore durableStore;
    private final SlidingWindowRateLimiter rateLimiter;
    private final CacheStatsCollector statsCollector;
    private final ObjectMapper objectMapper;
    private final InFlightFetches inFlight;

    public TieredCacheService(FastStore fastStore,
                              DurableStore durableStore,
                              SlidingWindowRateLimiter rateLimiter,
                              CacheStatsCollector statsCollector,
                              ObjectMapper objectMapper,
                              boolean singleFlight) {
        this.fastStore = fastStore;
        this.durableStore = durableStore;
        this.rateLimiter = rateLimiter;
        this.statsCollector = statsCollector;
        this.objectMapper = objectMapper;
        this.inFlight = singleFlight ? new InFlightFetches() : null;
    }

    public <T> T getCached(CacheLookup lookup, Class<T> type, RemoteFetcher fetcher) {
        return lookup(lookup, objectMapper.constructType(type), fetcher);
    }

    public <T> T getCached(CacheLookup lookup, TypeReference<T> type, RemoteFetcher fetcher) {
        return lookup(lookup, objectMapper.getTypeFactory().constructType(type), fetcher);
    }

    public JsonNode getCachedJson(CacheLookup lookup, RemoteFetcher fetcher) {
        return lookup(lookup, objectMapper.constructType(JsonNode.class), fetcher);
    }

    /**
     * Forces a remote fetch and repopulates both tiers. Still subject to the rate limiter.
     */
    public JsonNode refresh(CacheLookup lookup, RemoteFetcher fetcher) {
        durableStore.checkLocation(lookup.category(), lookup.durableKey());
        log.info("Force refreshing: {}", lookup.fastKey());
        return loadFromRemote(lookup, fetcher, null);
    }

    /**
     * Deletes the durable entry. The fast-store copy is left to expire on its own TTL.
     *
     * @throws StoreUnavailableException when the durable entry cannot be deleted
     */
    public void invalidate(String category, String durableKey) {
        durableStore.delete(category, durableKey);
        log.info("Invalidated cache entry: {}/{}", category, durableKey);
    }

    /**
     * Durable footprint merged with live counters. Never fails: parts that cannot be computed are left out.
     */
    public CacheStats getStats() {
        Map<String, CategoryFootprint> footprints;
        try {
            footprints = durableStore.stats();
        } catch (RuntimeException e) {
            log.warn("Durable store stats unavailable: {}", e.getMessage());
            footprints = Map.of();
        }
        Map<String, CategoryCounters> counters;
        try {
            counters = statsCollector.snapshot();
        } catch (RuntimeException e) {
            log.warn("Category counters unavailable, returning stats without per-category metrics: {}", e.getMessage());
            counters = Map.of();
        }

        Map<String, CategoryStats> categories = new TreeMap<>();
        for (Map.Entry<String, CategoryFootprint> e : footprints.entrySet()) {
            CategoryCounters c = counters.getOrDefault(e.getKey(), CategoryCounters.EMPTY);
            categories.put(e.getKey(), new CategoryStats(e.getValue().keys(), e.getValue().sizeBytes(),
                    CacheCategory.describe(e.getKey()), c.hits(), c.misses(), c.requests()));
        }
        for (Map.Entry<String, CategoryCounters> e : counters.entrySet()) {
            CategoryCounters c = e.getValue();
            if (!categories.containsKey(e.getKey()) && c.requests() > 0) {
                categories.put(e.getKey(), new CategoryStats(0, 0, CacheCategory.describe(e.getKey()),
                        c.hits(), c.misses(), c.requests()));
            }
        }

        long totalKeys = categories.values().stream().mapToLong(CategoryStats::keys).sum();
        long totalSize = categories.values().stream().mapToLong(CategoryStats::sizeBytes).sum();
        long hits = counters.values().stream().mapToLong(CategoryCounters::hits).sum();
        return new CacheStats(totalKeys, totalSize, categories.size(),
                durableStore.getBasePath().toString(), categories, hits);
    }

    private <T> T lookup(CacheLookup lookup, JavaType type, RemoteFetcher fetcher) {
        durableStore.checkLocation(lookup.category(), lookup.durableKey());

        Optional<T> fast = readFast(lookup, type);
        if (fast.isPresent()) {
            log.debug("Fast cache hit: {}", lookup.fastKey());
            recordHit(lookup.category());
            return fast.get();
        }

        Optional<JsonNode> durable = readDurable(lookup);
        if (durable.isPresent()) {
            Optional<T> value = convertQuietly(durable.get(), type, lookup);
            if (value.isPresent()) {
                log.debug("Durable cache hit: {}/{}", lookup.category(), lookup.durableKey());
                recordHit(lookup.category());
                writeFast(lookup, durable.get()).logIfFailed(log);
                return value.get();
            }
        }

        log.info("Cache miss, fetching from API: {}", lookup.fastKey());
        recordMiss(lookup.category());
        JsonNode fetched = loadFromRemote(lookup, fetcher, type);
        return convert(fetched, type, lookup);
    }

    private JsonNode loadFromRemote(CacheLookup lookup, RemoteFetcher fetcher, JavaType type) {
        if (inFlight == null) {
            return fetchAndPopulate(lookup, fetcher, type);
        }
        return inFlight.run(lookup.fastKey(), () -> fetchAndPopulate(lookup, fetcher, type));
    }

    private JsonNode fetchAndPopulate(CacheLookup lookup, RemoteFetcher fetcher, JavaType type) {
        if (!rateLimiter.tryAdmit()) {
            throw new RateLimitExceededException(rateLimiter.getLimit());
        }
        JsonNode value = invoke(lookup, fetcher);
        if (type != null) {
            // rejects payloads of the wrong shape before they reach either tier
            convert(value, type, lookup);
        }
        writeFast(lookup, value).logIfFailed(log);
        writeDurable(lookup, value).logIfFailed(log);
        return value;
    }

    private JsonNode invoke(CacheLookup lookup, RemoteFetcher fetcher) {
        JsonNode value;
        try {
            value = fetcher.fetch();
        } catch (GatewayCacheException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new FetchFailedException("Failed to fetch " + lookup.fastKey() + ": " + e.getMessage(), e);
        }
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new FetchFailedException("Fetcher returned no data for " + lookup.fastKey(), null);
        }
        return value;
    }

    private <T> Optional<T> readFast(CacheLookup lookup, JavaType type) {
        Optional<String> cached = fastStore.get(lookup.fastKey());
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(cached.get(), type);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException e) {
            log.debug("Undecodable fast cache value for {}, falling through: {}", lookup.fastKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> readDurable(CacheLookup lookup) {
        try {
            if (!durableStore.isValid(lookup.category(), lookup.durableKey(), lookup.durableTtl().toSeconds())) {
                return Optional.empty();
            }
            return durableStore.read(lookup.category(), lookup.durableKey());
        } catch (StoreUnavailableException e) {
            log.warn("Durable cache read failed for {}/{}: {}", lookup.category(), lookup.durableKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private WriteOutcome writeFast(CacheLookup lookup, JsonNode value) {
        try {
            return fastStore.set(lookup.fastKey(), objectMapper.writeValueAsString(value), lookup.fastTtl());
        } catch (JsonProcessingException e) {
            return WriteOutcome.failed(WriteOutcome.Tier.FAST, lookup.fastKey(), e);
        }
    }

    private WriteOutcome writeDurable(CacheLookup lookup, JsonNode value) {
        String location = lookup.category() + "/" + lookup.durableKey();
        try {
            durableStore.write(lookup.category(), lookup.durableKey(), value, lookup.durableTtl().toSeconds());
            return WriteOutcome.written(WriteOutcome.Tier.DURABLE, location);
        } catch (RuntimeException e) {
            return WriteOutcome.failed(WriteOutcome.Tier.DURABLE, location, e);
        }
    }

    private <T> T convert(JsonNode node, JavaType type, CacheLookup lookup) {
        try {
            return objectMapper.readerFor(type).readValue(node);
        } catch (IOException e) {
            throw new DeserializeFailedException(
                    "Response for " + lookup.fastKey() + " is not a " + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> convertQuietly(JsonNode node, JavaType type, CacheLookup lookup) {
        try {
            return Optional.ofNullable(objectMapper.readerFor(type).readValue(node));
        } catch (IOException e) {
            log.warn("Durable cache entry {}/{} has unexpected shape, treating as miss", lookup.category(), lookup.durableKey());
            return Optional.empty();
        }
    }

    private void recordHit(String category) {
        try {
            statsCollector.recordHit(category);
        } catch (RuntimeException e) {
            log.warn("Failed to record cache hit for {}: {}", category, e.getMessage());
        }
    }

    private void recordMiss(String category) {
        try {
            statsCollector.recordMiss(category);
        } catch (RuntimeException e) {
            log.warn("Failed to record cache miss for {}: {}", category, e.getMessage());
        }
    }
}
