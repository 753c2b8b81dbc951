package com.dmarket.arb.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/** Wire shape of {@code GET /exchange/v1/market/items}. Prices are cent amounts sent as strings. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketItemsResponse {
    private List<Item> objects;
    private String cursor;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String itemId;
        private String title;
        private String gameId;
        private Price price;
        private Price suggestedPrice;
        private Extra extra;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Price {
        @JsonProperty("USD")
        private String usd;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Extra {
        private String category;
        private Integer saleCount;
    }
}
