package com.kaspagateway.cache.faststore;

import com.github.benmanes.caffeine.cache.Ticker;
import com.kaspagateway.cache.WriteOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineFastStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    @Test
    @DisplayName("value is readable until its own TTL elapses")
    void perEntryTtl() {
        CaffeineFastStore store = new CaffeineFastStore("kg:", 100, ticker);
        store.set("short", "a", Duration.ofSeconds(30));
        store.set("long", "b", Duration.ofSeconds(300));

        nanos.addAndGet(Duration.ofSeconds(29).toNanos());
        assertThat(store.get("short")).contains("a");

        nanos.addAndGet(Duration.ofSeconds(1).toNanos());
        assertThat(store.get("short")).isEmpty();
        assertThat(store.get("long")).contains("b");
    }

    @Test
    @DisplayName("overwrite resets the TTL")
    void overwriteResetsTtl() {
        CaffeineFastStore store = new CaffeineFastStore("", 100, ticker);
        store.set("k", "v1", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());
        store.set("k", "v2", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());

        assertThat(store.get("k")).contains("v2");
    }

    @Test
    @DisplayName("non-positive TTL is a failed write, not an exception")
    void rejectsNonPositiveTtl() {
        CaffeineFastStore store = new CaffeineFastStore("", 100, ticker);
        WriteOutcome outcome = store.set("k", "v", Duration.ZERO);

        assertThat(outcome.isWritten()).isFalse();
        assertThat(outcome.tier()).isEqualTo(WriteOutcome.Tier.FAST);
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    @DisplayName("clear behaves as if every entry expired")
    void clear() {
        CaffeineFastStore store = new CaffeineFastStore("", 100, ticker);
        store.set("a", "1", Duration.ofMinutes(1));
        store.set("b", "2", Duration.ofMinutes(1));
        store.clear();

        assertThat(store.get("a")).isEmpty();
        assertThat(store.estimatedSize()).isZero();
    }
}
