package com.dmarket.arb.domain;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A contiguous slice of a tier's price range, bounds inclusive, in cents.
 */
@Value
public class PriceSegment {
    int position;
    long priceFrom;
    long priceTo;

    /**
     * Splits {@code [priceFrom, priceTo]} into at most {@code count} contiguous, non-overlapping
     * segments of near-equal width. Positions start at 0 in ascending price order.
     */
    public static List<PriceSegment> split(long priceFrom, long priceTo, int count) {
        if (priceTo < priceFrom) {
            throw new IllegalArgumentException("priceTo " + priceTo + " is below priceFrom " + priceFrom);
        }
        long width = priceTo - priceFrom + 1;
        int pieces = (int) Math.max(1, Math.min(count, width));
        List<PriceSegment> segments = new ArrayList<>(pieces);
        for (int i = 0; i < pieces; i++) {
            long from = priceFrom + width * i / pieces;
            long to = priceFrom + width * (i + 1) / pieces - 1;
            segments.add(new PriceSegment(i, from, to));
        }
        return segments;
    }
}
