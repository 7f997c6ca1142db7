package com.kaspagateway.marketplace;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.kaspagateway.cache.CacheLookup;
import com.kaspagateway.cache.CacheTier;
import com.kaspagateway.cache.RemoteFetcher;
import com.kaspagateway.cache.TieredCacheService;
import com.kaspagateway.marketplace.client.MarketplaceClient;
import com.kaspagateway.marketplace.config.MarketplaceProperties;
import com.kaspagateway.marketplace.model.KnsListedOrders;
import com.kaspagateway.marketplace.model.TokenInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketplaceServiceTest {

    private static final JsonNode EMPTY = JsonNodeFactory.instance.objectNode();

    @Mock
    private TieredCacheService cache;
    @Mock
    private MarketplaceClient client;
    @Spy
    private MarketplaceProperties properties = new MarketplaceProperties();

    @InjectMocks
    private MarketplaceService service;

    private CacheLookup captureJsonLookup() throws Exception {
        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        ArgumentCaptor<RemoteFetcher> fetcher = ArgumentCaptor.forClass(RemoteFetcher.class);
        verify(cache).getCachedJson(lookup.capture(), fetcher.capture());
        fetcher.getValue().fetch();
        return lookup.getValue();
    }

    @Test
    @DisplayName("trade stats with ticker: upper-cased ticker in both keys, WARM tier")
    void tradeStatsKeys() throws Exception {
        service.getTradeStats("6h", "nacho");

        CacheLookup lookup = captureJsonLookup();
        assertThat(lookup.fastKey()).isEqualTo("kaspa:trade_stats:6h:NACHO");
        assertThat(lookup.category()).isEqualTo("trade_stats");
        assertThat(lookup.durableKey()).isEqualTo("6h_NACHO");
        assertThat(lookup.fastTtl()).isEqualTo(CacheTier.WARM.getFastTtl());
        verify(client).fetchTradeStats("6h", "NACHO");
    }

    @Test
    @DisplayName("trade stats without ticker uses the time frame alone")
    void tradeStatsNoTicker() throws Exception {
        service.getTradeStats("1d", " ");

        CacheLookup lookup = captureJsonLookup();
        assertThat(lookup.fastKey()).isEqualTo("kaspa:trade_stats:1d");
        assertThat(lookup.durableKey()).isEqualTo("1d");
        verify(client).fetchTradeStats("1d", null);
    }

    @Test
    @DisplayName("sold orders default to a 60 minute window on the HOT tier")
    void soldOrdersDefaults() throws Exception {
        service.getSoldOrders(null, null);

        CacheLookup lookup = captureJsonLookup();
        assertThat(lookup.fastKey()).isEqualTo("kaspa:sold_orders:all:60");
        assertThat(lookup.category()).isEqualTo("orders");
        assertThat(lookup.durableKey()).isEqualTo("all_60");
        assertThat(lookup.durableTtl()).isEqualTo(CacheTier.HOT.getDurableTtl());
        verify(client).fetchSoldOrders(null, 60);
    }

    @Test
    @DisplayName("token info is typed, COLD tier, keyed by upper-case ticker")
    void tokenInfo() throws Exception {
        TokenInfo info = new TokenInfo("KAS", null, null, 0, null, null, 0, null, null, null, 0, "deployed", null, null, null);
        when(cache.getCached(any(CacheLookup.class), eq(TokenInfo.class), any(RemoteFetcher.class))).thenReturn(info);

        assertThat(service.getTokenInfo("kas")).isSameAs(info);

        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache).getCached(lookup.capture(), eq(TokenInfo.class), any(RemoteFetcher.class));
        assertThat(lookup.getValue().fastKey()).isEqualTo("kaspa:token_info:KAS");
        assertThat(lookup.getValue().category()).isEqualTo("tokens");
        assertThat(lookup.getValue().durableTtl()).isEqualTo(CacheTier.COLD.getDurableTtl());
    }

    @Test
    @DisplayName("refresh token info goes through refresh with the same lookup")
    void refreshTokenInfo() throws Exception {
        when(cache.refresh(any(CacheLookup.class), any(RemoteFetcher.class))).thenReturn(EMPTY);

        service.refreshTokenInfo("Kas");

        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        ArgumentCaptor<RemoteFetcher> fetcher = ArgumentCaptor.forClass(RemoteFetcher.class);
        verify(cache).refresh(lookup.capture(), fetcher.capture());
        fetcher.getValue().fetch();
        assertThat(lookup.getValue().fastKey()).isEqualTo("kaspa:token_info:KAS");
        verify(client).fetchTokenInfo("KAS");
    }

    @Test
    @DisplayName("floor prices and hot mints use typed list lookups")
    @SuppressWarnings("unchecked")
    void typedLists() {
        service.getFloorPrices(null);
        service.getHotMints("1h");

        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(2)).getCached(lookup.capture(), any(TypeReference.class), any(RemoteFetcher.class));
        assertThat(lookup.getAllValues()).extracting(CacheLookup::fastKey)
                .containsExactly("kaspa:floor_price:all", "kaspa:hot_mints:1h");
        assertThat(lookup.getAllValues()).extracting(CacheLookup::category)
                .containsExactly("floor_prices", "hot_mints");
    }

    @Test
    @DisplayName("logos are STATIC, historical data COLD, krc721 collection WARM")
    void tiers() {
        service.getTokenLogos("nacho");
        service.getHistoricalData("7d", "nacho");
        service.getKrc721CollectionInfo("nacho");

        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(3)).getCachedJson(lookup.capture(), any(RemoteFetcher.class));
        assertThat(lookup.getAllValues().get(0).durableTtl()).isEqualTo(CacheTier.STATIC.getDurableTtl());
        assertThat(lookup.getAllValues().get(0).durableKey()).isEqualTo("NACHO");
        assertThat(lookup.getAllValues().get(1).fastKey()).isEqualTo("kaspa:historical:NACHO:7d");
        assertThat(lookup.getAllValues().get(1).durableTtl()).isEqualTo(CacheTier.COLD.getDurableTtl());
        assertThat(lookup.getAllValues().get(2).durableKey()).isEqualTo("collection_NACHO");
        assertThat(lookup.getAllValues().get(2).durableTtl()).isEqualTo(CacheTier.WARM.getDurableTtl());
    }

    @Test
    @DisplayName("kns and krc721 trade stats share the stats_<tf>[_<x>] durable key shape")
    void statsKeys() {
        service.getKnsTradeStats("1w", "foo.kas");
        service.getKrc721TradeStats("all", null);

        ArgumentCaptor<CacheLookup> lookup = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(2)).getCachedJson(lookup.capture(), any(RemoteFetcher.class));
        assertThat(lookup.getAllValues().get(0).fastKey()).isEqualTo("kaspa:kns:stats:1w:foo.kas");
        assertThat(lookup.getAllValues().get(0).durableKey()).isEqualTo("stats_1w_foo.kas");
        assertThat(lookup.getAllValues().get(1).category()).isEqualTo("krc721");
        assertThat(lookup.getAllValues().get(1).durableKey()).isEqualTo("stats_all");
    }

    @Test
    @DisplayName("operations needing a ticker reject a blank one without touching the cache")
    void requiresTicker() {
        assertThatThrownBy(() -> service.getTokenInfo(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getHistoricalData("6h", null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(cache);
    }

    @Test
    @DisplayName("krc721 market data uses the krc721 category with per-kind key prefixes")
    @SuppressWarnings("unchecked")
    void krc721Keys() {
        service.getKrc721Mints("bitcoin");
        service.getKrc721SoldOrders(null, null);
        service.getKrc721ListedOrders("bitcoin");
        service.getKrc721HotMints("1d");
        service.getKrc721FloorPrices(null);

        ArgumentCaptor<CacheLookup> json = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(3)).getCachedJson(json.capture(), any(RemoteFetcher.class));
        assertThat(json.getAllValues()).extracting(CacheLookup::fastKey)
                .containsExactly("kaspa:krc721:mints:BITCOIN", "kaspa:krc721:sold:all:60", "kaspa:krc721:listed:BITCOIN");
        assertThat(json.getAllValues()).extracting(CacheLookup::durableKey)
                .containsExactly("mints_BITCOIN", "sold_all_60", "listed_BITCOIN");
        assertThat(json.getAllValues()).extracting(CacheLookup::fastTtl)
                .containsExactly(CacheTier.WARM.getFastTtl(), CacheTier.HOT.getFastTtl(), CacheTier.HOT.getFastTtl());

        ArgumentCaptor<CacheLookup> typed = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(2)).getCached(typed.capture(), any(TypeReference.class), any(RemoteFetcher.class));
        assertThat(typed.getAllValues()).extracting(CacheLookup::durableKey).containsExactly("hot_mints_1d", "floor_all");
        assertThat(typed.getAllValues()).extracting(CacheLookup::category).containsOnly("krc721");
        assertThat(typed.getAllValues().get(1).durableTtl()).isEqualTo(CacheTier.HOT.getDurableTtl());
    }

    @Test
    @DisplayName("nft metadata is cached on the COLD tier and fetched with the normalized ticker")
    void nftMetadata() throws Exception {
        service.getNftMetadata("bitcoin", 42);

        CacheLookup lookup = captureJsonLookup();
        assertThat(lookup.fastKey()).isEqualTo("kaspa:krc721:metadata:BITCOIN:42");
        assertThat(lookup.durableKey()).isEqualTo("metadata_BITCOIN_42");
        assertThat(lookup.durableTtl()).isEqualTo(CacheTier.COLD.getDurableTtl());
        verify(client).fetchNftMetadata("BITCOIN", 42);
    }

    @Test
    @DisplayName("krc721 token search bypasses the cache")
    void krc721TokensUncached() {
        JsonNode filter = JsonNodeFactory.instance.objectNode().put("ticker", "BITCOIN");
        when(client.fetchKrc721Tokens(filter)).thenReturn(EMPTY);

        assertThat(service.getKrc721Tokens(filter)).isSameAs(EMPTY);
        verifyNoInteractions(cache);
    }

    @Test
    @DisplayName("kns sold orders key on minutes; listed orders are unwrapped from their envelope")
    void knsOrders() throws Exception {
        JsonNode order = JsonNodeFactory.instance.objectNode().put("assetId", "foo.kas");
        when(cache.getCached(any(CacheLookup.class), eq(KnsListedOrders.class), any(RemoteFetcher.class)))
                .thenReturn(new KnsListedOrders(List.of(order)), new KnsListedOrders(null));

        service.getKnsSoldOrders(15);
        assertThat(service.getKnsListedOrders()).containsExactly(order);
        assertThat(service.getKnsListedOrders()).isEmpty();

        CacheLookup sold = captureJsonLookup();
        assertThat(sold.fastKey()).isEqualTo("kaspa:kns:sold:15");
        assertThat(sold.durableKey()).isEqualTo("sold_15");
        assertThat(sold.category()).isEqualTo("kns");
        verify(client).fetchKnsSoldOrders(15);

        ArgumentCaptor<CacheLookup> listed = ArgumentCaptor.forClass(CacheLookup.class);
        verify(cache, times(2)).getCached(listed.capture(), eq(KnsListedOrders.class), any(RemoteFetcher.class));
        assertThat(listed.getValue().fastKey()).isEqualTo("kaspa:kns:listed");
        assertThat(listed.getValue().durableKey()).isEqualTo("listed");
        assertThat(listed.getValue().fastTtl()).isEqualTo(CacheTier.HOT.getFastTtl());
    }

    @Test
    @DisplayName("configured tokens keep their order and are looked up exactly, then case-insensitively")
    void configuredTokens() {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        tokens.put("Kaspa", List.of("kucoin", "mexc"));
        tokens.put("Nacho", List.of("xeggex"));
        properties.setTokens(tokens);

        assertThat(service.getConfiguredTokens()).containsExactly("Kaspa", "Nacho");
        assertThat(service.getTokenExchanges("Nacho")).contains(List.of("xeggex"));
        assertThat(service.getTokenExchanges("KASPA")).contains(List.of("kucoin", "mexc"));
        assertThat(service.getTokenExchanges("Ghost")).isEmpty();
        verifyNoInteractions(cache, client);
    }
}
