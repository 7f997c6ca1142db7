package com.kaspagateway.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied fetch of fresh data from the remote source. Owns its own timeout.
 * A {@code null} result or a JSON {@code null} payload is treated as a failed fetch and never cached.
 */
@FunctionalInterface
public interface RemoteFetcher {

    JsonNode fetch() throws Exception;
}
