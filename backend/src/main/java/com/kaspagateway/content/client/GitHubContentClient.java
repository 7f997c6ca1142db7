package com.kaspagateway.content.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.kaspagateway.cache.FetchFailedException;
import com.kaspagateway.content.config.ContentProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * GitHub contents API (GET /repos/{owner}/{repo}/contents/{path}). Returns the raw response: an array for
 * directories, an object for files.
 */
@Slf4j
public class GitHubContentClient {

    static final String GITHUB_JSON = "application/vnd.github.v3+json";
    static final String USER_AGENT = "KaspaGatewayCacheProxy/1.0";
    private static final int PER_PAGE = 100;

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public GitHubContentClient(WebClient.Builder builder, ContentProperties properties, RateLimiter rateLimiter) {
        WebClient.Builder b = builder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT);
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken().strip());
        }
        this.webClient = b.build();
        this.rateLimiter = rateLimiter;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    /**
     * @param path repository-relative path without leading slash; empty for the repository root
     */
    public JsonNode fetchContents(String owner, String repo, String path) {
        String location = owner + "/" + repo + "/" + path;
        if (!rateLimiter.acquirePermission()) {
            throw new FetchFailedException("Local GitHub limiter exhausted before fetching " + location, null);
        }
        log.debug("Fetching GitHub contents {}", location);
        try {
            return webClient.get()
                    .uri(u -> {
                        u.pathSegment("repos", owner, repo, "contents");
                        if (!path.isEmpty()) {
                            u.path("/" + path);
                        }
                        return u.queryParam("per_page", PER_PAGE).build();
                    })
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new FetchFailedException("GitHub API returned " + e.getStatusCode().value() + " for " + location, e);
        } catch (RuntimeException e) {
            throw new FetchFailedException("Failed to fetch " + location + " from GitHub: " + e.getMessage(), e);
        }
    }
}
