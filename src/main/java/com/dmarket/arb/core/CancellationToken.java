package com.dmarket.arb.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal shared by one scan cycle. Once cancelled it stays cancelled.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
