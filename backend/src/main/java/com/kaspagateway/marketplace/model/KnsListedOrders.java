package com.kaspagateway.marketplace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Envelope of the KNS listed-orders response. Orders are passed through untyped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KnsListedOrders(List<JsonNode> orders) {
}
