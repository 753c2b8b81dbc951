package com.dmarket.arb.infra;

import com.dmarket.arb.domain.AggregatedPrice;
import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.ListingPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the two marketplace endpoints the scanner needs. Responses are decoded strictly:
 * a 2xx body that does not have the expected shape becomes {@link ApiError.Kind#MALFORMED_RESPONSE}
 * and is never cached.
 */
@Slf4j
public class MarketApiClient {

    static final String MARKET_ITEMS_PATH = "/exchange/v1/market/items";
    static final String AGGREGATED_PRICES_PATH = "/marketplace-api/v1/aggregated-prices";
    static final int MAX_TITLES_PER_REQUEST = 100;

    private final RequestExecutor executor;
    private final TieredCache cache;
    private final ObjectMapper objectMapper;

    public MarketApiClient(RequestExecutor executor, TieredCache cache, ObjectMapper objectMapper) {
        this.executor = executor;
        this.cache = cache;
        this.objectMapper = objectMapper;
    }

    /**
     * One page of offers for {@code gameId} priced within {@code [priceFrom, priceTo]} cents,
     * cheapest first.
     */
    public ApiResult<ListingPage> getListings(String gameId, long priceFrom, long priceTo, int limit, String cursor) {
        RequestSpec.RequestSpecBuilder spec = RequestSpec.builder()
                .method("GET")
                .path(MARKET_ITEMS_PATH)
                .query("gameId", gameId)
                .query("limit", Integer.toString(limit))
                .query("currency", "USD")
                .query("priceFrom", Long.toString(priceFrom))
                .query("priceTo", Long.toString(priceTo))
                .query("orderBy", "price")
                .query("orderDir", "asc")
                .cachePolicy(CachePolicy.LISTING);
        if (cursor != null && !cursor.isBlank()) {
            spec.query("cursor", cursor);
        }
        return fetch(spec.build(), body -> decodeListings(body, gameId));
    }

    /**
     * Aggregated book data keyed by title. Titles are requested in batches of
     * {@value #MAX_TITLES_PER_REQUEST}; the first failing batch fails the whole lookup.
     */
    public ApiResult<Map<String, AggregatedPrice>> getAggregatedPrices(String gameId, Collection<String> titles) {
        Map<String, AggregatedPrice> byTitle = new LinkedHashMap<>();
        List<String> distinct = titles.stream().distinct().toList();
        for (int from = 0; from < distinct.size(); from += MAX_TITLES_PER_REQUEST) {
            List<String> batch = distinct.subList(from, Math.min(distinct.size(), from + MAX_TITLES_PER_REQUEST));
            RequestSpec spec = RequestSpec.builder()
                    .method("POST")
                    .path(AGGREGATED_PRICES_PATH)
                    .body(aggregatedPricesBody(gameId, batch))
                    .cachePolicy(CachePolicy.REFERENCE)
                    .build();
            ApiResult<List<AggregatedPrice>> result = fetch(spec, this::decodeAggregatedPrices);
            if (!result.isSuccess()) {
                return ApiResult.failure(result.getError());
            }
            result.getValue().forEach(price -> byTitle.put(price.getTitle(), price));
        }
        return ApiResult.success(byTitle);
    }

    private <T> ApiResult<T> fetch(RequestSpec spec, Decoder<T> decoder) {
        Optional<String> cached = cache.get(spec);
        if (cached.isPresent()) {
            try {
                return ApiResult.success(decoder.decode(cached.get()));
            } catch (MalformedResponseException e) {
                log.warn("[API] Dropping undecodable cache entry for {}: {}", spec.getPath(), e.getMessage());
                cache.invalidate(spec);
            }
        }

        ApiResult<ApiResponse> response = executor.send(spec);
        if (!response.isSuccess()) {
            return ApiResult.failure(response.getError());
        }
        String body = response.getValue().getBody();
        try {
            T decoded = decoder.decode(body);
            cache.put(spec, body);
            return ApiResult.success(decoded);
        } catch (MalformedResponseException e) {
            log.warn("[API] Malformed response from {}: {}", spec.getPath(), e.getMessage());
            return ApiResult.failure(ApiError.malformed(e.getMessage()));
        }
    }

    private ListingPage decodeListings(String body, String requestedGameId) throws MalformedResponseException {
        MarketItemsResponse response = read(body, MarketItemsResponse.class);
        if (response.getObjects() == null) {
            throw new MalformedResponseException("missing 'objects' array");
        }
        List<Listing> listings = new ArrayList<>(response.getObjects().size());
        for (MarketItemsResponse.Item item : response.getObjects()) {
            if (item == null || isBlank(item.getItemId()) || isBlank(item.getTitle())) {
                throw new MalformedResponseException("listing without itemId or title");
            }
            if (item.getPrice() == null) {
                throw new MalformedResponseException("listing " + item.getItemId() + " has no price");
            }
            long price = parseCents(item.getPrice().getUsd(), "price of " + item.getItemId());
            Long suggested = null;
            if (item.getSuggestedPrice() != null && !isBlank(item.getSuggestedPrice().getUsd())) {
                suggested = parseCents(item.getSuggestedPrice().getUsd(), "suggested price of " + item.getItemId());
            }
            MarketItemsResponse.Extra extra = item.getExtra();
            listings.add(Listing.builder()
                    .itemId(item.getItemId())
                    .title(item.getTitle())
                    .gameId(isBlank(item.getGameId()) ? requestedGameId : item.getGameId())
                    .category(extra != null ? extra.getCategory() : null)
                    .price(price)
                    .suggestedPrice(suggested)
                    .recentSales(extra != null ? extra.getSaleCount() : null)
                    .build());
        }
        return new ListingPage(listings, response.getCursor());
    }

    private List<AggregatedPrice> decodeAggregatedPrices(String body) throws MalformedResponseException {
        AggregatedPricesResponse response = read(body, AggregatedPricesResponse.class);
        if (response.getAggregatedPrices() == null) {
            throw new MalformedResponseException("missing 'aggregatedPrices' array");
        }
        List<AggregatedPrice> prices = new ArrayList<>(response.getAggregatedPrices().size());
        for (AggregatedPricesResponse.Entry entry : response.getAggregatedPrices()) {
            if (entry == null || isBlank(entry.getTitle())) {
                throw new MalformedResponseException("aggregated price without title");
            }
            prices.add(AggregatedPrice.builder()
                    .title(entry.getTitle())
                    .offerBestPrice(isBlank(entry.getOfferBestPrice()) ? 0 : parseCents(entry.getOfferBestPrice(), "offerBestPrice"))
                    .offerCount(entry.getOfferCount() != null ? entry.getOfferCount() : 0)
                    .orderBestPrice(isBlank(entry.getOrderBestPrice()) ? 0 : parseCents(entry.getOrderBestPrice(), "orderBestPrice"))
                    .orderCount(entry.getOrderCount() != null ? entry.getOrderCount() : 0)
                    .build());
        }
        return prices;
    }

    private String aggregatedPricesBody(String gameId, List<String> titles) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode filter = root.putObject("filter");
        filter.put("game", gameId);
        ArrayNode titleArray = filter.putArray("titles");
        titles.forEach(titleArray::add);
        root.put("limit", Integer.toString(MAX_TITLES_PER_REQUEST));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise aggregated prices request", e);
        }
    }

    private <T> T read(String body, Class<T> type) throws MalformedResponseException {
        if (isBlank(body)) {
            throw new MalformedResponseException("empty body");
        }
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new MalformedResponseException("null document");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("invalid JSON: " + e.getOriginalMessage());
        }
    }

    private static long parseCents(String raw, String field) throws MalformedResponseException {
        if (raw == null) {
            throw new MalformedResponseException(field + " is missing");
        }
        long cents;
        try {
            cents = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException(field + " is not an integer cent amount: " + raw);
        }
        if (cents < 0) {
            throw new MalformedResponseException(field + " is negative: " + raw);
        }
        return cents;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @FunctionalInterface
    private interface Decoder<T> {
        T decode(String body) throws MalformedResponseException;
    }

    private static class MalformedResponseException extends Exception {
        MalformedResponseException(String message) {
            super(message);
        }
    }
}
