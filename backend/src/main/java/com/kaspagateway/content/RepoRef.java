package com.kaspagateway.content;

/**
 * (source, owner, repo) triple identifying a content repository, e.g. github/KaspaDev/Kaspa-Exchange-Data.
 */
public record RepoRef(String source, String owner, String repo) {

    @Override
    public String toString() {
        return source + "/" + owner + "/" + repo;
    }
}
