package com.kaspagateway.config;

import com.kaspagateway.cache.faststore.CaffeineFastStore;
import com.kaspagateway.cache.faststore.FastStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "kaspagateway.cache.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryFastStoreConfig {

    @Bean
    public FastStore inMemoryFastStore(CacheProperties properties) {
        return new CaffeineFastStore(properties.getRedis().getKeyPrefix(), properties.getInMemoryMaximumSize());
    }
}
