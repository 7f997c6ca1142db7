package com.kaspagateway.cache.durable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaspagateway.cache.StoreUnavailableException;
import com.kaspagateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurableStoreTest {

    @TempDir
    Path baseDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private DurableStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new DurableStore(baseDir, mapper, clock, "test");
    }

    @Test
    @DisplayName("write then read returns the same JSON document")
    void writeThenRead() throws IOException {
        JsonNode payload = mapper.readTree("{\"ticker\":\"KAS\",\"holders\":[1,2,3]}");

        store.write("tokens", "KAS", payload, 3600);

        assertThat(store.read("tokens", "KAS")).contains(payload);
        assertThat(Files.exists(baseDir.resolve("tokens").resolve("KAS" + DurableStore.PAYLOAD_SUFFIX))).isTrue();
        CacheMetadata meta = mapper.readValue(
                baseDir.resolve("tokens").resolve("KAS" + DurableStore.METADATA_SUFFIX).toFile(), CacheMetadata.class);
        assertThat(meta.cachedAt()).isEqualTo(clock.instant().getEpochSecond());
        assertThat(meta.ttlSeconds()).isEqualTo(3600);
        assertThat(meta.source()).isEqualTo("test");
    }

    @Test
    @DisplayName("validity is strict: age must be below max age")
    void validityBoundary() throws IOException {
        store.write("orders", "last", mapper.readTree("[]"), 300);

        assertThat(store.isValid("orders", "last", 300)).isTrue();
        clock.advance(Duration.ofSeconds(299));
        assertThat(store.isValid("orders", "last", 300)).isTrue();
        clock.advance(Duration.ofSeconds(1));
        assertThat(store.isValid("orders", "last", 300)).isFalse();
    }

    @Test
    @DisplayName("metadata from the future is treated as age zero")
    void futureTimestampIsFresh() throws IOException {
        store.write("orders", "last", mapper.readTree("[]"), 300);
        clock.advance(Duration.ofSeconds(-120));
        assertThat(store.isValid("orders", "last", 300)).isTrue();
    }

    @Test
    @DisplayName("missing entry, missing metadata and corrupt metadata are all invalid")
    void invalidStates() throws IOException {
        assertThat(store.isValid("tokens", "NOPE", 3600)).isFalse();

        store.write("tokens", "KAS", mapper.readTree("{}"), 3600);
        Path meta = baseDir.resolve("tokens").resolve("KAS" + DurableStore.METADATA_SUFFIX);
        Files.writeString(meta, "not json");
        assertThat(store.isValid("tokens", "KAS", 3600)).isFalse();

        Files.delete(meta);
        assertThat(store.isValid("tokens", "KAS", 3600)).isFalse();
    }

    @Test
    @DisplayName("read of a missing entry is empty, read of a corrupt payload fails")
    void readMissingAndCorrupt() throws IOException {
        assertThat(store.read("tokens", "NOPE")).isEmpty();

        Files.createDirectories(baseDir.resolve("tokens"));
        Files.writeString(baseDir.resolve("tokens").resolve("BAD" + DurableStore.PAYLOAD_SUFFIX), "plain text, not gzip");
        assertThatThrownBy(() -> store.read("tokens", "BAD")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("rewriting an entry replaces payload and refreshes timestamp")
    void overwrite() throws IOException {
        store.write("tokens", "KAS", mapper.readTree("{\"v\":1}"), 60);
        clock.advance(Duration.ofSeconds(59));
        store.write("tokens", "KAS", mapper.readTree("{\"v\":2}"), 60);
        clock.advance(Duration.ofSeconds(30));

        assertThat(store.isValid("tokens", "KAS", 60)).isTrue();
        assertThat(store.read("tokens", "KAS").orElseThrow().get("v").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("no temp files are left behind after writes")
    void noTempFilesLeft() throws IOException {
        store.write("tokens", "KAS", mapper.readTree("{}"), 60);
        store.write("tokens", "KAS", mapper.readTree("{}"), 60);
        try (Stream<Path> files = Files.list(baseDir.resolve("tokens"))) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        }
        assertThat(store.listKeys("tokens")).containsExactly("KAS");
    }

    @Test
    @DisplayName("delete is idempotent")
    void deleteIdempotent() throws IOException {
        store.write("tokens", "KAS", mapper.readTree("{}"), 60);
        store.delete("tokens", "KAS");
        store.delete("tokens", "KAS");

        assertThat(store.read("tokens", "KAS")).isEmpty();
        assertThat(store.isValid("tokens", "KAS", 60)).isFalse();
    }

    @Test
    @DisplayName("keys that could escape the category directory are rejected")
    void rejectsUnsafeNames() {
        JsonNode payload = mapper.createObjectNode();
        assertThatThrownBy(() -> store.write("tokens", "../evil", payload, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("..", "KAS", payload, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read("tokens", "a/b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.checkLocation("tokens", "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("tokens", "KAS", payload, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("cleanup removes only expired entries")
    void cleanupExpired() throws IOException {
        store.write("orders", "old", mapper.readTree("[]"), 300);
        clock.advance(Duration.ofSeconds(200));
        store.write("orders", "new", mapper.readTree("[]"), 300);
        clock.advance(Duration.ofSeconds(150));

        int deleted = store.cleanupExpired("orders", 300);

        assertThat(deleted).isEqualTo(1);
        assertThat(store.listKeys("orders")).containsExactly("new");
    }

    @Test
    @DisplayName("stats lists known categories, extra directories and payload sizes")
    void stats() throws IOException {
        store.write("tokens", "KAS", mapper.readTree("{\"a\":1}"), 60);
        store.write("tokens", "NACHO", mapper.readTree("{\"a\":2}"), 60);
        store.write("custom", "x", mapper.readTree("{}"), 60);

        Map<String, CategoryFootprint> stats = store.stats();

        assertThat(stats.get("tokens").keys()).isEqualTo(2);
        assertThat(stats.get("tokens").sizeBytes()).isPositive();
        assertThat(stats.get("orders")).isEqualTo(CategoryFootprint.EMPTY);
        assertThat(stats.get("custom").keys()).isEqualTo(1);
    }
}
