package com.dmarket.arb.domain;

import lombok.Value;

import java.util.List;

@Value
public class ListingPage {
    List<Listing> listings;
    String nextCursor; // null or blank on the last page

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
