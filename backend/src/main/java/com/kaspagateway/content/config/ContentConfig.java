package com.kaspagateway.content.config;

import com.kaspagateway.content.client.GitHubContentClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ContentProperties.class)
public class ContentConfig {

    @Bean(name = "githubRateLimiter")
    public RateLimiter githubRateLimiter(ContentProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofHours(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerHour()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("github-content", config);
    }

    @Bean
    public GitHubContentClient gitHubContentClient(WebClient.Builder webClientBuilder,
                                                   ContentProperties properties,
                                                   @Qualifier("githubRateLimiter") RateLimiter githubRateLimiter) {
        return new GitHubContentClient(webClientBuilder, properties, githubRateLimiter);
    }
}
