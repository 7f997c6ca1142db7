package com.kaspagateway.api.dto;

import java.time.Instant;

/**
 * Error response body: error (code such as RATE_LIMIT_EXCEEDED), message, timestamp (ISO 8601).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
