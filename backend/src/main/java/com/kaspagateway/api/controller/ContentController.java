package com.kaspagateway.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.kaspagateway.content.ContentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GET /v1/api/{source}/{owner}/{repo}/{path...}: allow-listed repository files and directory listings.
 * The literal /v1/api/kaspa/... mappings are more specific and take precedence.
 */
@RestController
@RequiredArgsConstructor
public class ContentController {

    private final ContentService contentService;

    @GetMapping("/v1/api/{source}/{owner}/{repo}/{*path}")
    public Mono<JsonNode> content(@PathVariable String source,
                                  @PathVariable String owner,
                                  @PathVariable String repo,
                                  @PathVariable String path) {
        return MarketplaceController.blocking(() -> contentService.getContent(source, owner, repo, path));
    }
}
