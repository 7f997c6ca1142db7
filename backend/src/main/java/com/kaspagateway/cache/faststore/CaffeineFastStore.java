package com.kaspagateway.cache.faststore;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.kaspagateway.cache.WriteOutcome;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process fast store with per-entry expiry. Intended for local/dev runs and tests (single JVM, not shared).
 */
public final class CaffeineFastStore implements FastStore {

    private record Entry(String value, long ttlNanos) {
    }

    private final Cache<String, Entry> cache;
    private final String prefix;

    public CaffeineFastStore(String prefix, long maximumSize) {
        this(prefix, maximumSize, Ticker.systemTicker());
    }

    public CaffeineFastStore(String prefix, long maximumSize, Ticker ticker) {
        this.prefix = prefix == null ? "" : prefix;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = cache.getIfPresent(k(key));
        return e == null ? Optional.empty() : Optional.of(e.value());
    }

    @Override
    public WriteOutcome set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return WriteOutcome.failed(WriteOutcome.Tier.FAST, key, new IllegalArgumentException("ttl must be positive"));
        }
        cache.put(k(key), new Entry(value, ttl.toNanos()));
        return WriteOutcome.written(WriteOutcome.Tier.FAST, key);
    }

    /**
     * Drops every entry, as if all TTLs had elapsed.
     */
    public void clear() {
        cache.invalidateAll();
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
