package com.kaspagateway.cache;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-lifetime counters; not persisted. Each category updates under its own monitor so a snapshot never sees
 * a request counted without its hit or miss.
 */
public class InMemoryCacheStatsCollector implements CacheStatsCollector {

    private final ConcurrentMap<String, Counters> counters = new ConcurrentHashMap<>();

    @Override
    public void recordHit(String category) {
        counters.computeIfAbsent(category, c -> new Counters()).record(true);
    }

    @Override
    public void recordMiss(String category) {
        counters.computeIfAbsent(category, c -> new Counters()).record(false);
    }

    @Override
    public Map<String, CategoryCounters> snapshot() {
        Map<String, CategoryCounters> copy = new TreeMap<>();
        counters.forEach((category, c) -> copy.put(category, c.snapshot()));
        return copy;
    }

    private static final class Counters {
        private long hits;
        private long misses;
        private long requests;

        synchronized void record(boolean hit) {
            if (hit) {
                hits++;
            } else {
                misses++;
            }
            requests++;
        }

        synchronized CategoryCounters snapshot() {
            return new CategoryCounters(hits, misses, requests);
        }
    }
}
