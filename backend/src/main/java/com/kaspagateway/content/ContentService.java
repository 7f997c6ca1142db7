package com.kaspagateway.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kaspagateway.cache.CacheCategory;
import com.kaspagateway.cache.CacheLookup;
import com.kaspagateway.cache.CacheTier;
import com.kaspagateway.cache.TieredCacheService;
import com.kaspagateway.content.client.GitHubContentClient;
import com.kaspagateway.content.config.ContentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Serves allow-listed repository content through the tiered cache.
 * Directories become {@code [{name, type, path}]}; base64 files are decoded and returned as parsed JSON when the
 * text is JSON, otherwise as {@code {name, path, content}}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentService {

    public static final String GITHUB = "github";

    private static final Pattern SAFE_PATH = Pattern.compile("[A-Za-z0-9._\\-/]*");

    private final TieredCacheService cache;
    private final GitHubContentClient client;
    private final ContentProperties properties;
    private final ObjectMapper objectMapper;

    public JsonNode getContent(String source, String owner, String repo, String path) {
        RepoRef ref = new RepoRef(source, owner, repo);
        if (!isAllowed(ref)) {
            log.warn("Rejected content request for non-allow-listed repository {}", ref);
            throw new ContentAccessDeniedException(ref);
        }
        if (!GITHUB.equals(source)) {
            throw new IllegalArgumentException("Unsupported content source: " + source);
        }
        String cleanPath = cleanPath(path);
        CacheLookup lookup = CacheLookup.of(
                "v1:gh:" + source + ":" + owner + ":" + repo + ":" + cleanPath,
                CacheCategory.CONTENT,
                durableKey(ref, cleanPath),
                CacheTier.WARM);
        return cache.getCachedJson(lookup, () -> shape(client.fetchContents(owner, repo, cleanPath)));
    }

    public boolean isAllowed(RepoRef ref) {
        return properties.getAllowedRepos().stream()
                .anyMatch(r -> ref.source().equals(r.getSource())
                        && ref.owner().equals(r.getOwner())
                        && ref.repo().equals(r.getRepo()));
    }

    JsonNode shape(JsonNode raw) {
        if (raw.isArray()) {
            ArrayNode listing = objectMapper.createArrayNode();
            for (JsonNode item : raw) {
                listing.addObject()
                        .put("name", item.path("name").asText())
                        .put("type", item.path("type").asText("unknown"))
                        .put("path", item.path("path").asText());
            }
            return listing;
        }
        if ("base64".equals(raw.path("encoding").asText()) && raw.hasNonNull("content")) {
            String text = new String(Base64.getMimeDecoder().decode(raw.get("content").asText()), StandardCharsets.UTF_8);
            try {
                return objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                ObjectNode file = objectMapper.createObjectNode();
                file.put("name", raw.path("name").asText());
                file.put("path", raw.path("path").asText());
                file.put("content", text);
                return file;
            }
        }
        ObjectNode file = objectMapper.createObjectNode();
        file.put("name", raw.path("name").asText());
        file.put("type", raw.path("type").asText("file"));
        file.put("path", raw.path("path").asText());
        return file;
    }

    static String cleanPath(String path) {
        String p = path == null ? "" : path.strip();
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (!SAFE_PATH.matcher(p).matches() || p.contains("//")) {
            throw new IllegalArgumentException("Invalid content path: " + path);
        }
        for (String segment : p.split("/")) {
            if (".".equals(segment) || "..".equals(segment)) {
                throw new IllegalArgumentException("Invalid content path: " + path);
            }
        }
        return p;
    }

    /** Durable file names cannot carry slashes, so the path is folded into a digest. */
    static String durableKey(RepoRef ref, String cleanPath) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(cleanPath.getBytes(StandardCharsets.UTF_8));
            return sanitize(ref.owner()) + "_" + sanitize(ref.repo()) + "_" + HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String sanitize(String s) {
        return s.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
