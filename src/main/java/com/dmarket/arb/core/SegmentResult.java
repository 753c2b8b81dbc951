package com.dmarket.arb.core;

import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.Opportunity;
import lombok.Value;

import java.util.List;

/**
 * What one fully paginated price segment produced: its own candidates and the listings kept for
 * tier-wide detection.
 */
@Value
public class SegmentResult {
    List<Opportunity> candidates;
    List<Listing> retainedListings;
    int listingsScanned;
}
