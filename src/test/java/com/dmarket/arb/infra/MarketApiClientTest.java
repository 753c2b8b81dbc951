package com.dmarket.arb.infra;

import com.dmarket.arb.domain.AggregatedPrice;
import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.ListingPage;
import com.dmarket.arb.support.FakeTicker;
import com.dmarket.arb.support.MutableClock;
import com.dmarket.arb.support.RecordingSleeper;
import com.dmarket.arb.support.TestData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class MarketApiClientTest {

    private static final String PAGE = """
            {"objects":[
              {"itemId":"i-1","title":"AK-47 | Redline","gameId":"a8db","price":{"USD":"1000"},
               "suggestedPrice":{"USD":"1500"},"extra":{"category":"Rifle","saleCount":12}},
              {"itemId":"i-2","title":"AWP | Asiimov","price":{"USD":"2500"}}
            ],"cursor":"next-1"}
            """;

    private final ObjectMapper objectMapper = TestData.objectMapper();
    private MockWebServer server;
    private MarketApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        MutableClock clock = MutableClock.atEpoch();
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        RequestExecutor executor = new RequestExecutor(
                new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(5)).build(),
                server.url("/").toString(),
                new RequestSigner(new ApiCredentials("", "")),
                new RateLimiter(100, Duration.ofSeconds(1), clock, sleeper),
                new CircuitBreaker("dmarket-api", 5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock),
                RetryPolicy.builder().build(),
                clock, sleeper, () -> 0.0);
        TieredCache cache = new TieredCache(100, Duration.ofMinutes(2), Duration.ofMinutes(15),
                RemoteCacheStore.NONE, clock, new FakeTicker(), Runnable::run);
        client = new MarketApiClient(executor, cache, objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void listingsAreDecodedIntoCents() throws Exception {
        server.enqueue(new MockResponse().setBody(PAGE));

        ListingPage page = client.getListings("a8db", 100, 5000, 100, null).getValue();

        assertEquals(2, page.getListings().size());
        assertEquals("next-1", page.getNextCursor());
        Listing first = page.getListings().get(0);
        assertEquals(1000, first.getPrice());
        assertEquals(1500L, first.getSuggestedPrice());
        assertEquals(12, first.getRecentSales());
        assertEquals("Rifle", first.getCategory());
        Listing second = page.getListings().get(1);
        assertNull(second.getSuggestedPrice());
        assertNull(second.getRecentSales());
        assertEquals("a8db", second.getGameId());

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/exchange/v1/market/items", request.getRequestUrl().encodedPath());
        assertEquals("100", request.getRequestUrl().queryParameter("priceFrom"));
        assertEquals("5000", request.getRequestUrl().queryParameter("priceTo"));
        assertEquals("price", request.getRequestUrl().queryParameter("orderBy"));
        assertNull(request.getRequestUrl().queryParameter("cursor"));
    }

    @Test
    void cursorIsForwarded() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"objects\":[]}"));

        ListingPage page = client.getListings("a8db", 100, 5000, 100, "next-1").getValue();

        assertFalse(page.hasNext());
        assertEquals("next-1", server.takeRequest().getRequestUrl().queryParameter("cursor"));
    }

    @Test
    void cachedPageIsServedWithoutSecondRequest() {
        server.enqueue(new MockResponse().setBody(PAGE));

        ListingPage first = client.getListings("a8db", 100, 5000, 100, null).getValue();
        ListingPage second = client.getListings("a8db", 100, 5000, 100, null).getValue();

        assertEquals(first, second);
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void malformedBodyIsReportedAndNotCached() {
        server.enqueue(new MockResponse().setBody("{\"objects\":[{\"itemId\":\"i-1\",\"title\":\"x\",\"price\":{\"USD\":\"12.5\"}}]}"));
        server.enqueue(new MockResponse().setBody(PAGE));

        ApiResult<ListingPage> broken = client.getListings("a8db", 100, 5000, 100, null);
        ApiResult<ListingPage> retried = client.getListings("a8db", 100, 5000, 100, null);

        assertEquals(ApiError.Kind.MALFORMED_RESPONSE, broken.getError().getKind());
        assertTrue(retried.isSuccess());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void missingObjectsArrayIsMalformed() {
        server.enqueue(new MockResponse().setBody("{\"cursor\":\"x\"}"));

        assertEquals(ApiError.Kind.MALFORMED_RESPONSE,
                client.getListings("a8db", 100, 5000, 100, null).getError().getKind());
    }

    @Test
    void upstreamErrorIsPassedThrough() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"not found\"}"));

        ApiError error = client.getListings("a8db", 100, 5000, 100, null).getError();

        assertEquals(ApiError.Kind.CLIENT_ERROR, error.getKind());
        assertEquals(404, error.getStatus());
    }

    @Test
    void aggregatedPricesAreKeyedByTitle() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"aggregatedPrices":[
                  {"title":"AK-47 | Redline","orderBestPrice":"900","orderCount":4,"offerBestPrice":"1000","offerCount":7}
                ]}
                """));

        Map<String, AggregatedPrice> prices = client.getAggregatedPrices("a8db", List.of("AK-47 | Redline")).getValue();

        AggregatedPrice price = prices.get("AK-47 | Redline");
        assertEquals(1000, price.getOfferBestPrice());
        assertEquals(900, price.getOrderBestPrice());
        assertEquals(22, price.liquidityScore());
        assertTrue(price.isLiquid());

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("a8db", body.path("filter").path("game").asText());
        assertEquals("AK-47 | Redline", body.path("filter").path("titles").get(0).asText());
    }

    @Test
    void titlesAreRequestedInBatchesOfHundred() throws Exception {
        List<String> titles = IntStream.range(0, 150).mapToObj(i -> "title-" + i).collect(Collectors.toList());
        server.enqueue(new MockResponse().setBody("{\"aggregatedPrices\":[{\"title\":\"title-0\",\"offerCount\":1}]}"));
        server.enqueue(new MockResponse().setBody("{\"aggregatedPrices\":[{\"title\":\"title-149\",\"orderCount\":2}]}"));

        Map<String, AggregatedPrice> prices = client.getAggregatedPrices("a8db", titles).getValue();

        assertEquals(2, server.getRequestCount());
        assertEquals(100, objectMapper.readTree(server.takeRequest().getBody().readUtf8()).path("filter").path("titles").size());
        assertEquals(50, objectMapper.readTree(server.takeRequest().getBody().readUtf8()).path("filter").path("titles").size());
        assertEquals(2, prices.size());
        assertEquals(4, prices.get("title-149").liquidityScore());
    }
}
