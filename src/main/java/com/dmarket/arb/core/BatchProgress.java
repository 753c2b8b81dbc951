package com.dmarket.arb.core;

import lombok.Value;

import java.util.List;

/**
 * Progress snapshot handed to a {@link BatchListener}.
 *
 * <p>{@code cursor} is the absolute position up to which every item succeeded;
 * {@code completedPrefix} holds the results of this run's items below it, in position order.
 */
@Value
public class BatchProgress<R> {
    int cursor;
    int succeeded;
    int failed;
    int total;
    List<R> completedPrefix;
    boolean finalSnapshot;
}
