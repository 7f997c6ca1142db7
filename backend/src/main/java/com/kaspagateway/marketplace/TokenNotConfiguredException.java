package com.kaspagateway.marketplace;

/**
 * Thrown when a token is looked up that is not listed under {@code kaspagateway.marketplace.tokens}.
 */
public class TokenNotConfiguredException extends RuntimeException {

    public TokenNotConfiguredException(String token) {
        super("Token '" + token + "' not found in configuration");
    }
}
