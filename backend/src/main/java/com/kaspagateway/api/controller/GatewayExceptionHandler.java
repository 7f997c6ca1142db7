package com.kaspagateway.api.controller;

import com.kaspagateway.api.dto.ErrorBody;
import com.kaspagateway.cache.DeserializeFailedException;
import com.kaspagateway.cache.FetchFailedException;
import com.kaspagateway.cache.GatewayCacheException;
import com.kaspagateway.cache.RateLimitExceededException;
import com.kaspagateway.cache.StoreUnavailableException;
import com.kaspagateway.common.SlidingWindowRateLimiter;
import com.kaspagateway.content.ContentAccessDeniedException;
import com.kaspagateway.marketplace.TokenNotConfiguredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;

/**
 * Maps cache and upstream failures to HTTP statuses with {@link ErrorBody}:
 * 429 rate limit (with Retry-After), 502 upstream fetch/shape, 503 durable store, 403 not allow-listed,
 * 404 unconfigured token, 400 bad input.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GatewayExceptionHandler {

    private final SlidingWindowRateLimiter upstreamRateLimiter;
    private final Clock clock;

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorBody> handleRateLimit(RateLimitExceededException ex) {
        long retryAfter = Math.max(1, upstreamRateLimiter.stats().resetEpochSeconds() - clock.millis() / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter))
                .body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler({FetchFailedException.class, DeserializeFailedException.class})
    public ResponseEntity<ErrorBody> handleUpstream(GatewayCacheException ex) {
        log.warn("Upstream failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorBody> handleStore(StoreUnavailableException ex) {
        log.error("Durable cache unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ContentAccessDeniedException.class)
    public ResponseEntity<ErrorBody> handleAccessDenied(ContentAccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorBody.of("ACCESS_DENIED", ex.getMessage()));
    }

    @ExceptionHandler(TokenNotConfiguredException.class)
    public ResponseEntity<ErrorBody> handleUnknownToken(TokenNotConfiguredException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }
}
