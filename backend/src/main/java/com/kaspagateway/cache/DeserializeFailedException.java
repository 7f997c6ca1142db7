package com.kaspagateway.cache;

/**
 * Fetched payload did not match the expected shape. Such payloads are never cached.
 */
public class DeserializeFailedException extends GatewayCacheException {

    public DeserializeFailedException(String message, Throwable cause) {
        super("DESERIALIZE_FAILED", message, cause);
    }
}
