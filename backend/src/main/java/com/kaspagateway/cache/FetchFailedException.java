package com.kaspagateway.cache;

/**
 * Upstream network error, non-2xx status, timeout or unparseable body.
 */
public class FetchFailedException extends GatewayCacheException {

    public FetchFailedException(String message, Throwable cause) {
        super("FETCH_FAILED", message, cause);
    }
}
