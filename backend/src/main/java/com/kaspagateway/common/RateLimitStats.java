package com.kaspagateway.common;

/**
 * Snapshot of the admission window: configured limit, admissions in window, room left, next reset (epoch seconds).
 */
public record RateLimitStats(int limit, int used, int remaining, long resetEpochSeconds) {
}
