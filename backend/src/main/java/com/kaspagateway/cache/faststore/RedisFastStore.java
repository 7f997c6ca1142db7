package com.kaspagateway.cache.faststore;

import com.kaspagateway.cache.WriteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis implementation using StringRedisTemplate. Keys are prefixed with the configured prefix (e.g. "kg:").
 */
@Slf4j
public final class RedisFastStore implements FastStore {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisFastStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(k(key)));
        } catch (RuntimeException e) {
            log.warn("Redis get failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public WriteOutcome set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return WriteOutcome.failed(WriteOutcome.Tier.FAST, key, new IllegalArgumentException("ttl must be positive"));
        }
        try {
            redis.opsForValue().set(k(key), value, ttl);
            return WriteOutcome.written(WriteOutcome.Tier.FAST, key);
        } catch (RuntimeException e) {
            return WriteOutcome.failed(WriteOutcome.Tier.FAST, key, e);
        }
    }
}
