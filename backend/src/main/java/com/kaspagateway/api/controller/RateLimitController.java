package com.kaspagateway.api.controller;

import com.kaspagateway.api.dto.RateLimitResponse;
import com.kaspagateway.common.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /rate-limit: current upstream admission window.
 */
@RestController
@RequiredArgsConstructor
public class RateLimitController {

    private final SlidingWindowRateLimiter upstreamRateLimiter;

    @GetMapping("/rate-limit")
    public RateLimitResponse rateLimit() {
        return RateLimitResponse.from(upstreamRateLimiter.stats());
    }
}
