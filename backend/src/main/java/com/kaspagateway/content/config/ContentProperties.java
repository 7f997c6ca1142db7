package com.kaspagateway.content.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Repository content proxy configuration. Documented in application.yml under kaspagateway.content.
 */
@ConfigurationProperties(prefix = "kaspagateway.content")
@Validated
@Getter
@Setter
public class ContentProperties {

    /**
     * GitHub REST API base URL.
     */
    @NotBlank
    private String baseUrl = "https://api.github.com";

    /**
     * Optional personal access token. Unauthenticated calls get a much lower GitHub quota.
     */
    private String token;

    /**
     * Local throttle, requests per hour (GitHub's authenticated quota is 5000).
     */
    @Min(1)
    private int requestsPerHour = 5000;

    /** How long a caller may wait for a local permit before the fetch fails. 0 = fail immediately. */
    @Min(0)
    private long limiterTimeoutMs = 0;

    @Min(1)
    private int timeoutSeconds = 30;

    /**
     * Repositories that may be served. Anything else is rejected with 403.
     */
    @Valid
    private List<AllowedRepo> allowedRepos = new ArrayList<>();

    @Getter
    @Setter
    public static class AllowedRepo {
        @NotBlank
        private String source = "github";
        @NotBlank
        private String owner;
        @NotBlank
        private String repo;
    }
}
