package com.dmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Market-wide aggregate for one title: best prices and depth of both book sides.
 */
@Value
@Builder
public class AggregatedPrice {
    String title;
    long offerBestPrice;
    int offerCount;
    long orderBestPrice;
    int orderCount;

    public int liquidityScore() {
        return Math.min(100, (offerCount + orderCount) * 2);
    }

    public boolean isLiquid() {
        return offerCount >= 5 && orderCount >= 3;
    }
}
