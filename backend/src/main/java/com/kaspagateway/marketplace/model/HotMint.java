package com.kaspagateway.marketplace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HotMint(String ticker, long changeTotalMints, BigDecimal totalMintPercentage, long totalHolders) {
}
