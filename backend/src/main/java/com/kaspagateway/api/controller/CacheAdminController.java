package com.kaspagateway.api.controller;

import com.kaspagateway.cache.CacheCategory;
import com.kaspagateway.cache.CacheStats;
import com.kaspagateway.cache.TieredCacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Cache introspection: GET stats, DELETE a durable entry.
 */
@RestController
@RequestMapping("/v1/api/kaspa/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final TieredCacheService tieredCacheService;

    @GetMapping("/stats")
    public Mono<CacheStats> stats() {
        return MarketplaceController.blocking(tieredCacheService::getStats);
    }

    @DeleteMapping("/{category}/{key}")
    public Mono<ResponseEntity<Void>> invalidate(@PathVariable String category, @PathVariable String key) {
        if (CacheCategory.fromDirectoryName(category).isEmpty()) {
            return Mono.error(new IllegalArgumentException("Unknown cache category: " + category));
        }
        return MarketplaceController.blocking(() -> {
            tieredCacheService.invalidate(category, key);
            return ResponseEntity.noContent().<Void>build();
        });
    }
}
