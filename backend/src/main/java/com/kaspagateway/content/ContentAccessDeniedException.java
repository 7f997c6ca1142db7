package com.kaspagateway.content;

import lombok.Getter;

/**
 * Requested repository is not on the allow-list.
 */
@Getter
public class ContentAccessDeniedException extends RuntimeException {

    private final RepoRef repo;

    public ContentAccessDeniedException(RepoRef repo) {
        super("Access denied for repository: " + repo);
        this.repo = repo;
    }
}
