package com.kaspagateway.cache;

import lombok.Getter;

/**
 * Base for failures surfaced by the tiered cache. API layer maps {@link #getErrorCode()} to an HTTP status.
 */
@Getter
public abstract class GatewayCacheException extends RuntimeException {

    /** RATE_LIMIT_EXCEEDED, FETCH_FAILED, DESERIALIZE_FAILED, STORE_UNAVAILABLE. */
    private final String errorCode;

    protected GatewayCacheException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
