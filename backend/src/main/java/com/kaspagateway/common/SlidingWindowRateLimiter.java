package com.kaspagateway.common;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window admission gate for the marketplace API: at most {@code limit} admissions per trailing 60 seconds.
 * Unlike a blocking limiter this never waits; a denied call is simply reported as {@code false}.
 */
public class SlidingWindowRateLimiter {

    public static final long WINDOW_MILLIS = 60_000L;

    private final int limit;
    private final Clock clock;
    private final Deque<Long> admittedAtMillis = new ArrayDeque<>();

    /**
     * @param limit admissions allowed per window, e.g. 1000; 0 admits nothing
     */
    public SlidingWindowRateLimiter(int limit) {
        this(limit, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(int limit, Clock clock) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        this.limit = limit;
        this.clock = clock;
    }

    /**
     * Prunes timestamps that left the window, then admits and records {@code now} if there is room.
     */
    public synchronized boolean tryAdmit() {
        long now = clock.millis();
        prune(now);
        if (admittedAtMillis.size() < limit) {
            admittedAtMillis.addLast(now);
            return true;
        }
        return false;
    }

    /**
     * Current window usage. {@code resetEpochSeconds} is the next wall-clock minute boundary,
     * which is what existing consumers of /rate-limit expect.
     */
    public synchronized RateLimitStats stats() {
        long now = clock.millis();
        prune(now);
        int used = admittedAtMillis.size();
        long nowSeconds = now / 1000;
        long reset = nowSeconds + (60 - nowSeconds % 60);
        return new RateLimitStats(limit, used, Math.max(0, limit - used), reset);
    }

    public int getLimit() {
        return limit;
    }

    private void prune(long now) {
        long windowStart = now - WINDOW_MILLIS;
        while (!admittedAtMillis.isEmpty() && admittedAtMillis.peekFirst() <= windowStart) {
            admittedAtMillis.pollFirst();
        }
    }
}
