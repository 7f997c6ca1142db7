package com.kaspagateway.marketplace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Token details from /api/token-info/{ticker}. Supply figures are in the token's smallest unit;
 * creationDate is epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenInfo(
        String ticker,
        Long creationDate,
        BigDecimal totalSupply,
        long totalMintTimes,
        BigDecimal totalMinted,
        BigDecimal totalMintedPercent,
        long totalHolders,
        BigDecimal preMintedSupply,
        BigDecimal mintLimit,
        String devWallet,
        long totalTrades,
        String state,
        BigDecimal price,
        BigDecimal marketCap,
        BigDecimal volumeUsd
) {
}
