package com.dmarket.arb.core;

import lombok.Value;

import java.util.List;

@Value
public class BatchResult<R> {
    List<R> successes; // in position order
    List<BatchFailure> failures;
    int skipped; // never attempted because of cancellation or abort
    int cursor;
    boolean cancelled;
    Throwable abortCause;

    public boolean isAborted() {
        return abortCause != null;
    }

    public boolean isComplete() {
        return !cancelled && abortCause == null && skipped == 0 && failures.isEmpty();
    }
}
