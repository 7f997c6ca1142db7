package com.kaspagateway.cache.durable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kaspagateway.cache.CacheCategory;
import com.kaspagateway.cache.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * On-disk, category-partitioned cache surviving restarts. Layout per entry:
 * <pre>
 *   {basePath}/{category}/{key}.json.gz    GZIP-compressed JSON payload
 *   {basePath}/{category}/{key}.meta.json  {@link CacheMetadata}
 * </pre>
 * Both files are written to a temp file and moved into place; the metadata move happens last, so
 * {@link #isValid} never accepts an entry whose payload is still being written.
 */
@Slf4j
public class DurableStore {

    static final String PAYLOAD_SUFFIX = ".json.gz";
    static final String METADATA_SUFFIX = ".meta.json";

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path basePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String source;

    public DurableStore(Path basePath, ObjectMapper objectMapper, Clock clock, String source) {
        this.basePath = basePath;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.source = source;
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            log.warn("Failed to create cache directory {}: {}", basePath, e.getMessage());
        }
    }

    /**
     * True only when payload and metadata both exist, metadata is readable and {@code now - cachedAt < maxAgeSeconds}.
     * Anything unverifiable counts as invalid.
     */
    public boolean isValid(String category, String key, long maxAgeSeconds) {
        Path meta = metadataPath(category, key);
        Path payload = payloadPath(category, key);
        if (!Files.isRegularFile(meta) || !Files.isRegularFile(payload)) {
            return false;
        }
        try {
            CacheMetadata metadata = objectMapper.readValue(meta.toFile(), CacheMetadata.class);
            long age = Math.max(0, nowSeconds() - metadata.cachedAt());
            return age < maxAgeSeconds;
        } catch (IOException | RuntimeException e) {
            log.debug("Unreadable metadata for {}/{}: {}", category, key, e.getMessage());
            return false;
        }
    }

    public void write(String category, String key, JsonNode payload, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        Path dir = categoryDir(category);
        Path payloadPath = payloadPath(category, key);
        Path metaPath = metadataPath(category, key);
        try {
            Files.createDirectories(dir);
            replaceAtomically(dir, key, payloadPath, out -> {
                try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                    objectMapper.writeValue(gzip, payload);
                }
            });
            CacheMetadata metadata = new CacheMetadata(nowSeconds(), source, ttlSeconds);
            replaceAtomically(dir, key, metaPath, out -> objectMapper.writeValue(out, metadata));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write cache entry " + category + "/" + key, e);
        }
        log.debug("Wrote cache entry: {}/{}", category, key);
    }

    /**
     * Payload regardless of staleness; empty when no entry exists.
     *
     * @throws StoreUnavailableException on I/O fault or an undecodable payload
     */
    public Optional<JsonNode> read(String category, String key) {
        Path payloadPath = payloadPath(category, key);
        if (!Files.isRegularFile(payloadPath)) {
            return Optional.empty();
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(payloadPath))) {
            JsonNode node = objectMapper.readTree(in);
            if (node == null || node.isMissingNode()) {
                throw new StoreUnavailableException("Empty cache entry " + category + "/" + key, null);
            }
            log.debug("Read cache entry: {}/{}", category, key);
            return Optional.of(node);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read cache entry " + category + "/" + key, e);
        }
    }

    /**
     * Removes metadata then payload. Deleting a missing entry is not an error.
     */
    public void delete(String category, String key) {
        try {
            Files.deleteIfExists(metadataPath(category, key));
            Files.deleteIfExists(payloadPath(category, key));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete cache entry " + category + "/" + key, e);
        }
        log.debug("Deleted cache entry: {}/{}", category, key);
    }

    public List<String> listKeys(String category) {
        Path dir = categoryDir(category);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(PAYLOAD_SUFFIX) && !name.startsWith("."))
                    .map(name -> name.substring(0, name.length() - PAYLOAD_SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list cache category " + category, e);
        }
    }

    /**
     * Deletes every entry of the category that is no longer valid for {@code maxAgeSeconds}.
     *
     * @return number of entries deleted
     */
    public int cleanupExpired(String category, long maxAgeSeconds) {
        int deleted = 0;
        for (String key : listKeys(category)) {
            if (!isValid(category, key, maxAgeSeconds)) {
                delete(category, key);
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Cleaned up {} expired entries from {}", deleted, category);
        }
        return deleted;
    }

    /**
     * Footprint of every known category plus any other category directory found on disk.
     * A category that cannot be read is reported as empty.
     */
    public Map<String, CategoryFootprint> stats() {
        List<String> categories = new ArrayList<>();
        for (CacheCategory c : CacheCategory.values()) {
            categories.add(c.getDirectoryName());
        }
        if (Files.isDirectory(basePath)) {
            try (Stream<Path> dirs = Files.list(basePath)) {
                dirs.filter(Files::isDirectory)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> SAFE_NAME.matcher(name).matches() && !categories.contains(name))
                        .sorted()
                        .forEach(categories::add);
            } catch (IOException e) {
                log.warn("Failed to scan cache directory {}: {}", basePath, e.getMessage());
            }
        }
        Map<String, CategoryFootprint> result = new LinkedHashMap<>();
        for (String category : categories) {
            result.put(category, footprint(category));
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException when category or key cannot be used as a file name
     */
    public void checkLocation(String category, String key) {
        requireSafe("category", category);
        requireSafe("key", key);
    }

    public Path getBasePath() {
        return basePath;
    }

    private CategoryFootprint footprint(String category) {
        try {
            List<String> keys = listKeys(category);
            long size = 0;
            for (String key : keys) {
                try {
                    size += Files.size(payloadPath(category, key));
                } catch (IOException e) {
                    log.debug("Payload {}/{} vanished during stats: {}", category, key, e.getMessage());
                }
            }
            return new CategoryFootprint(keys.size(), size);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to compute footprint of {}: {}", category, e.getMessage());
            return CategoryFootprint.EMPTY;
        }
    }

    private void replaceAtomically(Path dir, String key, Path target, StreamWriter writer) throws IOException {
        Path tmp = dir.resolve("." + key + "." + UUID.randomUUID() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                writer.write(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }

    private Path categoryDir(String category) {
        return basePath.resolve(requireSafe("category", category));
    }

    private Path payloadPath(String category, String key) {
        return categoryDir(category).resolve(requireSafe("key", key) + PAYLOAD_SUFFIX);
    }

    private Path metadataPath(String category, String key) {
        return categoryDir(category).resolve(requireSafe("key", key) + METADATA_SUFFIX);
    }

    private static String requireSafe(String what, String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches() || ".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("Invalid cache " + what + ": " + name);
        }
        return name;
    }

    @FunctionalInterface
    private interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }
}
