package com.kaspagateway.marketplace.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.kaspagateway.cache.FetchFailedException;
import com.kaspagateway.common.RetryPolicy;
import com.kaspagateway.marketplace.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Blocking client for the Kaspa marketplace REST API. Meant to be called from cache fetchers, which run off the
 * event loop. Transient failures are retried per {@link RetryPolicy}; anything else surfaces as
 * {@link FetchFailedException}.
 */
@Slf4j
public class MarketplaceClient {

    public static final String USER_AGENT = "KaspaGatewayCacheProxy/1.0";

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final String metadataBaseUrl;

    public MarketplaceClient(WebClient.Builder builder, MarketplaceProperties properties, RetryPolicy retryPolicy) {
        this.webClient = builder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.retryPolicy = retryPolicy;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.metadataBaseUrl = properties.getMetadataBaseUrl();
    }

    public static String normalizeTicker(String ticker) {
        return ticker == null ? null : ticker.strip().toUpperCase(Locale.ROOT);
    }

    /** GET /api/trade-stats?timeFrame=..&ticker=.. */
    public JsonNode fetchTradeStats(String timeFrame, String ticker) {
        return get("trade stats", b -> withOptional(b.path("/api/trade-stats").queryParam("timeFrame", timeFrame),
                "ticker", normalizeTicker(ticker)).build());
    }

    /** GET /api/floor-price?ticker=.. */
    public JsonNode fetchFloorPrices(String ticker) {
        return get("floor prices", b -> withOptional(b.path("/api/floor-price"), "ticker", normalizeTicker(ticker)).build());
    }

    /** GET /api/sold-orders?ticker=..&minutes=.. */
    public JsonNode fetchSoldOrders(String ticker, int minutes) {
        return get("sold orders", b -> withOptional(b.path("/api/sold-orders"), "ticker", normalizeTicker(ticker))
                .queryParam("minutes", minutes).build());
    }

    public JsonNode fetchLastOrderSold() {
        return get("last order sold", b -> b.path("/api/last-order-sold").build());
    }

    /** GET /api/hot-mints?timeInterval=.. */
    public JsonNode fetchHotMints(String timeInterval) {
        return get("hot mints", b -> b.path("/api/hot-mints").queryParam("timeInterval", timeInterval).build());
    }

    public JsonNode fetchTokenInfo(String ticker) {
        return get("token info", b -> b.path("/api/token-info/{ticker}").build(normalizeTicker(ticker)));
    }

    /** GET /api/tokens-logos?ticker=.. */
    public JsonNode fetchTokenLogos(String ticker) {
        return get("token logos", b -> withOptional(b.path("/api/tokens-logos"), "ticker", normalizeTicker(ticker)).build());
    }

    public JsonNode fetchOpenOrders() {
        return get("open orders", b -> b.path("/api/open-orders").build());
    }

    /** GET /api/historical-data?timeFrame=..&ticker=.. */
    public JsonNode fetchHistoricalData(String timeFrame, String ticker) {
        return get("historical data", b -> b.path("/api/historical-data")
                .queryParam("timeFrame", timeFrame)
                .queryParam("ticker", normalizeTicker(ticker))
                .build());
    }

    public JsonNode fetchKrc721CollectionInfo(String ticker) {
        return get("krc721 collection", b -> b.path("/krc721/{ticker}").build(normalizeTicker(ticker)));
    }

    /** GET /api/krc721/trade-stats?timeFrame=..&ticker=.. */
    public JsonNode fetchKrc721TradeStats(String timeFrame, String ticker) {
        return get("krc721 trade stats", b -> withOptional(b.path("/api/krc721/trade-stats").queryParam("timeFrame", timeFrame),
                "ticker", normalizeTicker(ticker)).build());
    }

    /** GET /api/kns/trade-stats?timeFrame=..&asset=.. */
    public JsonNode fetchKnsTradeStats(String timeFrame, String asset) {
        return get("kns trade stats", b -> withOptional(b.path("/api/kns/trade-stats").queryParam("timeFrame", timeFrame),
                "asset", asset).build());
    }

    /** GET /api/krc721/mint?ticker=.. */
    public JsonNode fetchKrc721Mints(String ticker) {
        return get("krc721 mints", b -> withOptional(b.path("/api/krc721/mint"), "ticker", normalizeTicker(ticker)).build());
    }

    /** GET /api/krc721/sold-orders?ticker=..&minutes=.. */
    public JsonNode fetchKrc721SoldOrders(String ticker, int minutes) {
        return get("krc721 sold orders", b -> withOptional(b.path("/api/krc721/sold-orders"), "ticker", normalizeTicker(ticker))
                .queryParam("minutes", minutes).build());
    }

    /** GET /api/krc721/listed-orders?ticker=.. */
    public JsonNode fetchKrc721ListedOrders(String ticker) {
        return get("krc721 listed orders", b -> withOptional(b.path("/api/krc721/listed-orders"), "ticker",
                normalizeTicker(ticker)).build());
    }

    /** GET /api/krc721/hot-mints?timeInterval=.. */
    public JsonNode fetchKrc721HotMints(String timeInterval) {
        return get("krc721 hot mints", b -> b.path("/api/krc721/hot-mints").queryParam("timeInterval", timeInterval).build());
    }

    /** GET /api/krc721/floor-price?ticker=.. */
    public JsonNode fetchKrc721FloorPrices(String ticker) {
        return get("krc721 floor prices", b -> withOptional(b.path("/api/krc721/floor-price"), "ticker",
                normalizeTicker(ticker)).build());
    }

    /**
     * POST /api/krc721/tokens with the caller's filter as the JSON body.
     */
    public JsonNode fetchKrc721Tokens(JsonNode filter) {
        return exchange("krc721 tokens", webClient.post()
                .uri(b -> b.path("/api/krc721/tokens").build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(filter));
    }

    /**
     * Token metadata lives on the krc721.stream cache, not on the marketplace host.
     */
    public JsonNode fetchNftMetadata(String ticker, long tokenId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(metadataBaseUrl)
                .path("/krc721/mainnet/metadata/{ticker}/{tokenId}")
                .buildAndExpand(normalizeTicker(ticker), tokenId)
                .toUri();
        return exchange("nft metadata", webClient.get().uri(uri));
    }

    /**
     * CDN address of the optimized token image. No request is made.
     */
    public String nftImageUrl(String ticker, long tokenId) {
        return UriComponentsBuilder.fromHttpUrl(metadataBaseUrl)
                .path("/krc721/mainnet/optimized/{ticker}/{tokenId}")
                .buildAndExpand(normalizeTicker(ticker), tokenId)
                .toUriString();
    }

    /** GET /api/kns/sold-orders?minutes=.. */
    public JsonNode fetchKnsSoldOrders(int minutes) {
        return get("kns sold orders", b -> b.path("/api/kns/sold-orders").queryParam("minutes", minutes).build());
    }

    public JsonNode fetchKnsListedOrders() {
        return get("kns listed orders", b -> b.path("/api/kns/listed-orders").build());
    }

    private JsonNode get(String what, Function<UriBuilder, URI> uri) {
        return exchange(what, webClient.get().uri(uri));
    }

    private JsonNode exchange(String what, WebClient.RequestHeadersSpec<?> request) {
        log.debug("Fetching {} from marketplace API", what);
        try {
            return request
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .retryWhen(retryPolicy.toReactorRetry(MarketplaceClient::isTransient))
                    .block();
        } catch (WebClientResponseException e) {
            throw new FetchFailedException("Marketplace API returned " + e.getStatusCode().value() + " for " + what, e);
        } catch (RuntimeException e) {
            throw new FetchFailedException("Failed to fetch " + what + " from marketplace API: " + e.getMessage(), e);
        }
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof WebClientResponseException e) {
            return e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
        }
        return t instanceof WebClientRequestException || t instanceof TimeoutException;
    }

    private static UriBuilder withOptional(UriBuilder builder, String name, String value) {
        return value == null || value.isBlank() ? builder : builder.queryParam(name, value);
    }
}
