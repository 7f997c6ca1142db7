package com.kaspagateway.cache.faststore;

import com.kaspagateway.cache.WriteOutcome;

import java.time.Duration;
import java.util.Optional;

/**
 * Low-latency key/value cache with per-key TTL. An optimization, never a source of truth:
 * implementations must not throw on connection failure.
 *
 * <ul>
 *   <li>{@link #get} degrades to empty when the store is unreachable.</li>
 *   <li>{@link #set} reports failures through the returned {@link WriteOutcome}.</li>
 *   <li>No delete; entries expire on their own TTL.</li>
 * </ul>
 */
public interface FastStore {

    Optional<String> get(String key);

    WriteOutcome set(String key, String value, Duration ttl);
}
