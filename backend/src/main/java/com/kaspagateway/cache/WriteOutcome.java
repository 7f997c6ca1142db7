package com.kaspagateway.cache;

import org.slf4j.Logger;

/**
 * Result of a best-effort cache write. Distinct from authoritative results: a failed outcome is logged by the caller,
 * never thrown.
 */
public record WriteOutcome(Tier tier, Status status, String key, Throwable cause) {

    public enum Tier { FAST, DURABLE }

    public enum Status { WRITTEN, FAILED }

    public static WriteOutcome written(Tier tier, String key) {
        return new WriteOutcome(tier, Status.WRITTEN, key, null);
    }

    public static WriteOutcome failed(Tier tier, String key, Throwable cause) {
        return new WriteOutcome(tier, Status.FAILED, key, cause);
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }

    /**
     * Logs a failed outcome at warn; written outcomes are silent.
     */
    public WriteOutcome logIfFailed(Logger log) {
        if (!isWritten()) {
            log.warn("Failed to write {} cache entry {}: {}", tier, key, cause != null ? cause.getMessage() : "unknown");
        }
        return this;
    }
}
