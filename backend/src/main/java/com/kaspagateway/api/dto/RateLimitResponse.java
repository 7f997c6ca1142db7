package com.kaspagateway.api.dto;

import com.kaspagateway.common.RateLimitStats;

/**
 * GitHub-style rate limit document: {"resources":{"core":{limit,remaining,reset,used}}}.
 */
public record RateLimitResponse(Resources resources) {

    public record Resources(Core core) {
    }

    public record Core(int limit, int remaining, long reset, int used) {
    }

    public static RateLimitResponse from(RateLimitStats stats) {
        return new RateLimitResponse(new Resources(
                new Core(stats.limit(), stats.remaining(), stats.resetEpochSeconds(), stats.used())));
    }
}
