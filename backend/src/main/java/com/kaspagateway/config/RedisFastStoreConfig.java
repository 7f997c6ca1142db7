package com.kaspagateway.config;

import com.kaspagateway.cache.faststore.FastStore;
import com.kaspagateway.cache.faststore.RedisFastStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed fast store. Connection settings come from spring.data.redis.*.
 */
@Configuration
@ConditionalOnProperty(prefix = "kaspagateway.cache.redis", name = "enabled", havingValue = "true")
public class RedisFastStoreConfig {

    @Bean
    public FastStore redisFastStore(StringRedisTemplate redisTemplate, CacheProperties properties) {
        return new RedisFastStore(redisTemplate, properties.getRedis().getKeyPrefix());
    }
}
