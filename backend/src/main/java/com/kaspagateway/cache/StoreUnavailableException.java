package com.kaspagateway.cache;

/**
 * Fast or durable store I/O failure. Recovered locally on read and write-back paths; surfaced only where no fallback exists.
 */
public class StoreUnavailableException extends GatewayCacheException {

    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
