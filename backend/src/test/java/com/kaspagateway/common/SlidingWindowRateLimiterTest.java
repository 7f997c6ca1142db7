package com.kaspagateway.common;

import com.kaspagateway.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("admits up to the limit within one window, then denies")
    void admitsUpToLimit() {
        MutableClock clock = new MutableClock(T0);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, clock);

        assertThat(limiter.tryAdmit()).isTrue();
        assertThat(limiter.tryAdmit()).isTrue();
        assertThat(limiter.tryAdmit()).isTrue();
        assertThat(limiter.tryAdmit()).isFalse();
        assertThat(limiter.stats().used()).isEqualTo(3);
        assertThat(limiter.stats().remaining()).isZero();
    }

    @Test
    @DisplayName("admission frees up exactly 60s after the oldest admitted call")
    void windowSlides() {
        MutableClock clock = new MutableClock(T0);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, clock);
        assertThat(limiter.tryAdmit()).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.tryAdmit()).isTrue();
        assertThat(limiter.tryAdmit()).isFalse();

        clock.advance(Duration.ofMillis(29_999));
        assertThat(limiter.tryAdmit()).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.tryAdmit()).isTrue();
        assertThat(limiter.stats().used()).isEqualTo(2);
    }

    @Test
    @DisplayName("denied calls are not recorded")
    void deniedCallsDoNotConsume() {
        MutableClock clock = new MutableClock(T0);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, clock);
        assertThat(limiter.tryAdmit()).isTrue();
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAdmit()).isFalse();
        }
        clock.advance(Duration.ofSeconds(60));
        assertThat(limiter.tryAdmit()).isTrue();
    }

    @Test
    @DisplayName("limit 0 admits nothing")
    void zeroLimitBlocksAll() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(0, new MutableClock(T0));
        assertThat(limiter.tryAdmit()).isFalse();
        assertThat(limiter.stats().limit()).isZero();
        assertThat(limiter.stats().remaining()).isZero();
    }

    @Test
    @DisplayName("stats: remaining = limit - used, reset is the next minute boundary")
    void statsShape() {
        MutableClock clock = new MutableClock(T0.plusSeconds(15));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10, clock);
        limiter.tryAdmit();
        limiter.tryAdmit();

        RateLimitStats stats = limiter.stats();

        assertThat(stats.limit()).isEqualTo(10);
        assertThat(stats.used()).isEqualTo(2);
        assertThat(stats.remaining()).isEqualTo(8);
        assertThat(stats.resetEpochSeconds()).isEqualTo(T0.getEpochSecond() + 60);
    }

    @Test
    @DisplayName("on an exact minute boundary reset points at the following minute")
    void resetOnBoundary() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10, new MutableClock(T0));
        assertThat(limiter.stats().resetEpochSeconds()).isEqualTo(T0.getEpochSecond() + 60);
    }

    @Test
    @DisplayName("concurrent callers never exceed the limit")
    void concurrentAdmissionsRespectLimit() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(50, new MutableClock(T0));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    if (limiter.tryAdmit()) {
                        admitted.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(admitted.get()).isEqualTo(50);
    }

    @Test
    @DisplayName("constructor rejects negative limit")
    void rejectsNegativeLimit() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }
}
