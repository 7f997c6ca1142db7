package com.kaspagateway.marketplace.config;

import com.kaspagateway.common.RetryPolicy;
import com.kaspagateway.marketplace.client.MarketplaceClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(MarketplaceProperties.class)
public class MarketplaceConfig {

    @Bean
    public MarketplaceClient marketplaceClient(WebClient.Builder webClientBuilder, MarketplaceProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                Duration.ofMillis(properties.getRetryBaseDelayMs()), 0.5, properties.getMaxRetries());
        return new MarketplaceClient(webClientBuilder, properties, retryPolicy);
    }
}
