package com.kaspagateway.api.dto;

import java.util.List;

public record AvailableTokensResponse(List<String> tokens, int count) {

    public static AvailableTokensResponse of(List<String> tokens) {
        return new AvailableTokensResponse(tokens, tokens.size());
    }
}
