package com.kaspagateway.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.kaspagateway.api.dto.AvailableTokensResponse;
import com.kaspagateway.api.dto.NftImageResponse;
import com.kaspagateway.api.dto.TokenExchangesResponse;
import com.kaspagateway.marketplace.MarketplaceService;
import com.kaspagateway.marketplace.TokenNotConfiguredException;
import com.kaspagateway.marketplace.model.FloorPriceEntry;
import com.kaspagateway.marketplace.model.HotMint;
import com.kaspagateway.marketplace.model.TokenInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Cached marketplace endpoints under /v1/api/kaspa. Lookups block on disk and upstream I/O, so they run on the
 * bounded elastic scheduler.
 */
@RestController
@RequestMapping("/v1/api/kaspa")
@RequiredArgsConstructor
public class MarketplaceController {

    private final MarketplaceService marketplaceService;

    @GetMapping("/trade-stats")
    public Mono<JsonNode> tradeStats(@RequestParam(defaultValue = RequestParams.DEFAULT_TIME_FRAME) String timeFrame,
                                     @RequestParam(required = false) String ticker) {
        String tf = RequestParams.timeFrame(timeFrame, "timeFrame");
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getTradeStats(tf, t));
    }

    @GetMapping("/floor-price")
    public Mono<List<FloorPriceEntry>> floorPrice(@RequestParam(required = false) String ticker) {
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getFloorPrices(t));
    }

    @GetMapping("/sold-orders")
    public Mono<JsonNode> soldOrders(@RequestParam(required = false) String ticker,
                                     @RequestParam(required = false) Integer minutes) {
        String t = RequestParams.optionalTicker(ticker);
        Integer m = RequestParams.minutes(minutes);
        return blocking(() -> marketplaceService.getSoldOrders(t, m));
    }

    @GetMapping("/last-order-sold")
    public Mono<JsonNode> lastOrderSold() {
        return blocking(marketplaceService::getLastOrderSold);
    }

    @GetMapping("/hot-mints")
    public Mono<List<HotMint>> hotMints(@RequestParam(defaultValue = RequestParams.DEFAULT_TIME_INTERVAL) String timeInterval) {
        String ti = RequestParams.timeFrame(timeInterval, "timeInterval");
        return blocking(() -> marketplaceService.getHotMints(ti));
    }

    @GetMapping("/token-info/{ticker}")
    public Mono<TokenInfo> tokenInfo(@PathVariable String ticker) {
        String t = RequestParams.ticker(ticker);
        return blocking(() -> marketplaceService.getTokenInfo(t));
    }

    @PostMapping("/token-info/{ticker}/refresh")
    public Mono<JsonNode> refreshTokenInfo(@PathVariable String ticker) {
        String t = RequestParams.ticker(ticker);
        return blocking(() -> marketplaceService.refreshTokenInfo(t));
    }

    @GetMapping("/tokens-logos")
    public Mono<JsonNode> tokenLogos(@RequestParam(required = false) String ticker) {
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getTokenLogos(t));
    }

    @GetMapping("/open-orders")
    public Mono<JsonNode> openOrders() {
        return blocking(marketplaceService::getOpenOrders);
    }

    @GetMapping("/historical-data")
    public Mono<JsonNode> historicalData(@RequestParam(defaultValue = RequestParams.DEFAULT_TIME_FRAME) String timeFrame,
                                         @RequestParam String ticker) {
        String tf = RequestParams.timeFrame(timeFrame, "timeFrame");
        String t = RequestParams.ticker(ticker);
        return blocking(() -> marketplaceService.getHistoricalData(tf, t));
    }

    @GetMapping("/krc721/collection/{ticker}")
    public Mono<JsonNode> krc721Collection(@PathVariable String ticker) {
        String t = RequestParams.ticker(ticker);
        return blocking(() -> marketplaceService.getKrc721CollectionInfo(t));
    }

    @GetMapping("/krc721/trade-stats")
    public Mono<JsonNode> krc721TradeStats(@RequestParam(defaultValue = RequestParams.DEFAULT_TIME_FRAME) String timeFrame,
                                           @RequestParam(required = false) String ticker) {
        String tf = RequestParams.timeFrame(timeFrame, "timeFrame");
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getKrc721TradeStats(tf, t));
    }

    @GetMapping("/krc721/mint")
    public Mono<JsonNode> krc721Mints(@RequestParam(required = false) String ticker) {
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getKrc721Mints(t));
    }

    @GetMapping("/krc721/sold-orders")
    public Mono<JsonNode> krc721SoldOrders(@RequestParam(required = false) String ticker,
                                           @RequestParam(required = false) Integer minutes) {
        String t = RequestParams.optionalTicker(ticker);
        Integer m = RequestParams.minutes(minutes);
        return blocking(() -> marketplaceService.getKrc721SoldOrders(t, m));
    }

    @GetMapping("/krc721/listed-orders")
    public Mono<JsonNode> krc721ListedOrders(@RequestParam(required = false) String ticker) {
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getKrc721ListedOrders(t));
    }

    @GetMapping("/krc721/hot-mints")
    public Mono<List<HotMint>> krc721HotMints(
            @RequestParam(defaultValue = RequestParams.DEFAULT_TIME_INTERVAL) String timeInterval) {
        String ti = RequestParams.timeFrame(timeInterval, "timeInterval");
        return blocking(() -> marketplaceService.getKrc721HotMints(ti));
    }

    @GetMapping("/krc721/floor-price")
    public Mono<List<FloorPriceEntry>> krc721FloorPrice(@RequestParam(required = false) String ticker) {
        String t = RequestParams.optionalTicker(ticker);
        return blocking(() -> marketplaceService.getKrc721FloorPrices(t));
    }

    @PostMapping("/krc721/tokens")
    public Mono<JsonNode> krc721Tokens(@RequestBody JsonNode filter) {
        if (!filter.isObject()) {
            throw new IllegalArgumentException("filter must be a JSON object");
        }
        return blocking(() -> marketplaceService.getKrc721Tokens(filter));
    }

    @GetMapping("/krc721/metadata/{ticker}/{tokenId}")
    public Mono<JsonNode> nftMetadata(@PathVariable String ticker, @PathVariable long tokenId) {
        String t = RequestParams.ticker(ticker);
        long id = RequestParams.tokenId(tokenId);
        return blocking(() -> marketplaceService.getNftMetadata(t, id));
    }

    @GetMapping("/krc721/image/{ticker}/{tokenId}")
    public NftImageResponse nftImage(@PathVariable String ticker, @PathVariable long tokenId) {
        String t = RequestParams.ticker(ticker);
        return new NftImageResponse(marketplaceService.getNftImageUrl(t, RequestParams.tokenId(tokenId)));
    }

    @GetMapping("/kns/sold-orders")
    public Mono<JsonNode> knsSoldOrders(@RequestParam(required = false) Integer minutes) {
        Integer m = RequestParams.minutes(minutes);
        return blocking(() -> marketplaceService.getKnsSoldOrders(m));
    }

    @GetMapping("/kns/listed-orders")
    public Mono<List<JsonNode>> knsListedOrders() {
        return blocking(marketplaceService::getKnsListedOrders);
    }

    @GetMapping("/kns/trade-stats")
    public Mono<JsonNode> knsTradeStats(@RequestParam(defaultValue = RequestParams.DEFAULT_TIME_FRAME) String timeFrame,
                                        @RequestParam(required = false) String asset) {
        String tf = RequestParams.timeFrame(timeFrame, "timeFrame");
        String a = RequestParams.optionalAsset(asset);
        return blocking(() -> marketplaceService.getKnsTradeStats(tf, a));
    }

    @GetMapping("/tokens")
    public AvailableTokensResponse tokens() {
        return AvailableTokensResponse.of(marketplaceService.getConfiguredTokens());
    }

    @GetMapping("/tokens/{token}/exchanges")
    public TokenExchangesResponse tokenExchanges(@PathVariable String token) {
        String t = RequestParams.token(token);
        return marketplaceService.getTokenExchanges(t)
                .map(exchanges -> new TokenExchangesResponse(t, exchanges))
                .orElseThrow(() -> new TokenNotConfiguredException(t));
    }

    static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
