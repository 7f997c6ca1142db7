package com.kaspagateway.api.dto;

/**
 * CDN location of an optimized NFT image.
 */
public record NftImageResponse(String imageUrl) {
}
