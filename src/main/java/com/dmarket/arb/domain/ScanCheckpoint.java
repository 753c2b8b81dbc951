package com.dmarket.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Durable progress record of one scan run.
 *
 * <p>{@code cursor} is the number of leading segments confirmed complete. It only ever grows for a
 * given run; segments finished out of order beyond it are redone after a resume. Besides the
 * opportunities found so far it keeps the listings still needed to pair copies of a title across
 * segments.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScanCheckpoint {
    String scanId;
    String cursor;
    long processedItems;
    ScanParameters parameters;
    @Singular
    List<Opportunity> opportunities;
    @Singular
    List<Listing> retainedListings;
    Status status;
    Instant updatedAt;

    public int resumePosition() {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        return Integer.parseInt(cursor);
    }

    public enum Status {
        IN_PROGRESS,
        INTERRUPTED,
        FAILED
    }
}
