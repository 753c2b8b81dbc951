package com.dmarket.arb.core;

import com.dmarket.arb.domain.AggregatedPrice;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;
import com.dmarket.arb.infra.ApiError;
import com.dmarket.arb.infra.ApiResult;
import com.dmarket.arb.infra.MarketApiClient;
import com.dmarket.arb.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.dmarket.arb.support.TestData.opportunity;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LiquidityEnricherTest {

    private MarketApiClient client;
    private LiquidityEnricher enricher;

    @BeforeEach
    void setUp() {
        client = mock(MarketApiClient.class);
        enricher = new LiquidityEnricher(client);
    }

    private static AggregatedPrice depth(String title, int offers, int orders) {
        return AggregatedPrice.builder().title(title).offerCount(offers).orderCount(orders).build();
    }

    @Test
    void aggregatedDepthReplacesSalesEstimate() {
        Opportunity candidate = opportunity("i-1", 1000, 1500, "39.50").toBuilder().liquidityScore(4).build();
        when(client.getAggregatedPrices(eq("a8db"), anyCollection()))
                .thenReturn(ApiResult.success(Map.of("Item i-1", depth("Item i-1", 10, 5))));

        List<Opportunity> enriched = enricher.enrich(List.of(candidate), TestData.parameters().build());

        assertEquals(30, enriched.get(0).getLiquidityScore());
    }

    @Test
    void filterDropsIlliquidButKeepsUnknown() {
        ScanParameters filtered = TestData.parameters().liquidityFilter(true).minLiquidityScore(20).build();
        Opportunity liquid = opportunity("liquid", 1000, 1500, "39.50");
        Opportunity thin = opportunity("thin", 1000, 1500, "39.50");
        Opportunity unknown = opportunity("unknown", 1000, 1500, "39.50");
        when(client.getAggregatedPrices(eq("a8db"), anyCollection())).thenReturn(ApiResult.success(Map.of(
                "Item liquid", depth("Item liquid", 8, 4),
                "Item thin", depth("Item thin", 2, 1))));

        List<Opportunity> enriched = enricher.enrich(List.of(liquid, thin, unknown), filtered);

        assertEquals(List.of("liquid", "unknown"), enriched.stream().map(Opportunity::getBuyItemId).toList());
    }

    @Test
    void failedLookupKeepsEstimates() {
        Opportunity candidate = opportunity("i-1", 1000, 1500, "39.50").toBuilder().liquidityScore(4).build();
        when(client.getAggregatedPrices(anyString(), anyCollection()))
                .thenReturn(ApiResult.failure(ApiError.unavailable(503, "down")));

        List<Opportunity> enriched = enricher.enrich(List.of(candidate), TestData.parameters().build());

        assertEquals(List.of(candidate), enriched);
    }

    @Test
    void noCandidatesMeansNoLookup() {
        assertTrue(enricher.enrich(List.of(), TestData.parameters().build()).isEmpty());
        verifyNoInteractions(client);
    }

    @Test
    void salesScoreIsCapped() {
        assertNull(LiquidityEnricher.salesScore(null));
        assertEquals(24, LiquidityEnricher.salesScore(12));
        assertEquals(100, LiquidityEnricher.salesScore(500));
    }
}
