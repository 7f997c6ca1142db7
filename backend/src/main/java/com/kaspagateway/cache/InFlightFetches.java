package com.kaspagateway.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent remote loads of the same key into one. The first caller runs the load; callers arriving
 * while it is in flight wait for its result or rethrow its failure. The entry is removed once the load settles.
 */
final class InFlightFetches {

    private final ConcurrentMap<String, CompletableFuture<JsonNode>> inFlight = new ConcurrentHashMap<>();

    JsonNode run(String key, Supplier<JsonNode> load) {
        CompletableFuture<JsonNode> mine = new CompletableFuture<>();
        CompletableFuture<JsonNode> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return await(key, existing);
        }
        try {
            JsonNode value = load.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    int size() {
        return inFlight.size();
    }

    private static JsonNode await(String key, CompletableFuture<JsonNode> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new FetchFailedException("Shared fetch failed for " + key, cause);
        }
    }
}
