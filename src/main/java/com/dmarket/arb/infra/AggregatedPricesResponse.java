package com.dmarket.arb.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/** Wire shape of {@code POST /marketplace-api/v1/aggregated-prices}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregatedPricesResponse {
    private List<Entry> aggregatedPrices;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String title;
        private String orderBestPrice;
        private Integer orderCount;
        private String offerBestPrice;
        private Integer offerCount;
    }
}
