package com.kaspagateway.api.controller;

import java.util.regex.Pattern;

/**
 * Query/path parameter checks shared by the controllers. Violations raise IllegalArgumentException (400).
 */
final class RequestParams {

    static final String DEFAULT_TIME_FRAME = "6h";
    static final String DEFAULT_TIME_INTERVAL = "1h";

    private static final Pattern TIME_FRAME = Pattern.compile("^[0-9]+[mhdwM]$|^all$");
    private static final Pattern TICKER = Pattern.compile("[A-Za-z0-9]{1,32}");
    private static final Pattern ASSET = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9 ._-]{1,64}");
    private static final int MAX_MINUTES = 10_080;

    private RequestParams() {
    }

    static String timeFrame(String value, String name) {
        if (value == null || !TIME_FRAME.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must look like 15m, 6h, 7d, 1w, 1M or all");
        }
        return value;
    }

    static String optionalTicker(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ticker(value);
    }

    static String ticker(String value) {
        if (value == null || !TICKER.matcher(value.strip()).matches()) {
            throw new IllegalArgumentException("ticker must be 1-32 letters or digits");
        }
        return value.strip();
    }

    static String optionalAsset(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        if (!ASSET.matcher(value.strip()).matches()) {
            throw new IllegalArgumentException("asset contains unsupported characters");
        }
        return value.strip();
    }

    static String token(String value) {
        if (value == null || !TOKEN.matcher(value.strip()).matches()) {
            throw new IllegalArgumentException("token contains unsupported characters");
        }
        return value.strip();
    }

    static long tokenId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("tokenId must not be negative");
        }
        return value;
    }

    static Integer minutes(Integer value) {
        if (value != null && (value < 1 || value > MAX_MINUTES)) {
            throw new IllegalArgumentException("minutes must be between 1 and " + MAX_MINUTES);
        }
        return value;
    }
}
