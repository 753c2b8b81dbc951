package com.dmarket.arb.core;

@FunctionalInterface
public interface ItemProcessor<T, R> {

    /** Processes one item. Any exception is recorded as that item's failure. */
    R process(T item) throws Exception;
}
