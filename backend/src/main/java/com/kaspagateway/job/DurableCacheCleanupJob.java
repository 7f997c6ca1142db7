package com.kaspagateway.job;

import com.kaspagateway.cache.CacheCategory;
import com.kaspagateway.cache.StoreUnavailableException;
import com.kaspagateway.cache.durable.DurableStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes durable entries older than their category's retention.
 */
@Component
@ConditionalOnProperty(prefix = "kaspagateway.cache", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DurableCacheCleanupJob {

    private final DurableStore durableStore;

    @Scheduled(
            fixedRateString = "${kaspagateway.cache.cleanup-interval-ms:3600000}",
            initialDelayString = "${kaspagateway.cache.cleanup-interval-ms:3600000}")
    public void runScheduled() {
        int total = cleanupAll();
        log.info("Durable cache cleanup finished, {} expired entries removed", total);
    }

    int cleanupAll() {
        int total = 0;
        for (CacheCategory category : CacheCategory.values()) {
            try {
                total += durableStore.cleanupExpired(category.getDirectoryName(), category.getRetention().toSeconds());
            } catch (StoreUnavailableException e) {
                log.warn("Cleanup of {} failed: {}", category.getDirectoryName(), e.getMessage());
            }
        }
        return total;
    }
}
