package com.kaspagateway.api.dto;

import java.util.List;

public record TokenExchangesResponse(String ticker, List<String> exchanges) {
}
