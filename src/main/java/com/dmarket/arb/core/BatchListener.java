package com.dmarket.arb.core;

public interface BatchListener<R> {

    /** Called after every chunk. */
    default void onProgress(BatchProgress<R> progress) {
    }

    /**
     * Called at the checkpoint cadence and once more before a cancelled or aborted run returns.
     * Calls are serialised and never see a lower cursor than a previous call. A thrown exception
     * is logged and the checkpoint is attempted again at the next chunk.
     */
    default void onCheckpoint(BatchProgress<R> progress) {
    }
}
