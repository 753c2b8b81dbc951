package com.dmarket.arb.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

@Value
@Builder(toBuilder = true)
public class BatchOptions {
    @Builder.Default
    int chunkSize = 1;
    @Builder.Default
    int maxConcurrency = 4;
    @Builder.Default
    int checkpointEveryItems = 10;
    @Builder.Default
    Duration checkpointInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration drainTimeout = Duration.ofSeconds(30);

    /** Absolute position of the first item, non-zero when resuming. */
    @Builder.Default
    int startOffset = 0;

    /** Item failures that stop dispatch of further chunks. */
    @Builder.Default
    Predicate<Throwable> abortOn = error -> false;
}
