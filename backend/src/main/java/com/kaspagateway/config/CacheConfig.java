package com.kaspagateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaspagateway.cache.CacheStatsCollector;
import com.kaspagateway.cache.InMemoryCacheStatsCollector;
import com.kaspagateway.cache.TieredCacheService;
import com.kaspagateway.cache.durable.DurableStore;
import com.kaspagateway.cache.faststore.FastStore;
import com.kaspagateway.common.SlidingWindowRateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Cache core wiring: durable store, upstream rate limiter, stats collector and the tiered orchestrator.
 * The fast store comes from {@link RedisFastStoreConfig} or {@link InMemoryFastStoreConfig}.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DurableStore durableStore(CacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new DurableStore(Path.of(properties.getBasePath()), objectMapper, clock, properties.getSource());
    }

    @Bean
    public SlidingWindowRateLimiter upstreamRateLimiter(CacheProperties properties, Clock clock) {
        return new SlidingWindowRateLimiter(properties.getRequestsPerMinute(), clock);
    }

    @Bean
    public CacheStatsCollector cacheStatsCollector() {
        return new InMemoryCacheStatsCollector();
    }

    @Bean
    public TieredCacheService tieredCacheService(FastStore fastStore,
                                                 DurableStore durableStore,
                                                 SlidingWindowRateLimiter upstreamRateLimiter,
                                                 CacheStatsCollector cacheStatsCollector,
                                                 ObjectMapper objectMapper,
                                                 CacheProperties properties) {
        return new TieredCacheService(fastStore, durableStore, upstreamRateLimiter, cacheStatsCollector,
                objectMapper, properties.isSingleFlight());
    }
}
