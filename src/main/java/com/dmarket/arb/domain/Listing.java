package com.dmarket.arb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One marketplace offer as returned by a listing page. Prices are in cents.
 */
@Value
@Builder
@Jacksonized
public class Listing {
    String itemId;
    String title;
    String gameId;
    String category;
    long price;
    Long suggestedPrice; // null when the marketplace has no reference price
    Integer recentSales; // null when the listing carries no sale counter

    public boolean hasSuggestedPrice() {
        return suggestedPrice != null && suggestedPrice > 0;
    }
}
