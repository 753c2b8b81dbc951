package com.dmarket.arb.core;

import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;

import java.util.List;

/**
 * Turns listings into candidate opportunities that already pass the profit thresholds of
 * {@code parameters}.
 *
 * <p>A detector that {@link #spansSegments() spans segments} runs once per tier, over the
 * listings every segment {@link #retain(List) retained}; the others run on each segment's listings
 * as soon as the segment is paginated.
 */
public interface OpportunityDetector {

    List<Opportunity> detect(List<Listing> listings, ScanParameters parameters);

    default boolean spansSegments() {
        return false;
    }

    /** The subset of one segment's listings this detector still needs once the segment is done. */
    default List<Listing> retain(List<Listing> segmentListings) {
        return List.of();
    }
}
