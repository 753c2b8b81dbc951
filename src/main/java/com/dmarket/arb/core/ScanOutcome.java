package com.dmarket.arb.core;

import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;
import com.dmarket.arb.domain.ScanState;
import com.dmarket.arb.infra.ApiError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Terminal result of one tier's scan run.
 */
@Value
@Builder
public class ScanOutcome {
    String scanId;
    ScanParameters parameters;
    ScanState state;
    @Singular
    List<Opportunity> opportunities;
    ApiError abortCause; // null unless aborted by an upstream error
    boolean cancelled;
    boolean resumed;
    int segmentsFailed;

    public boolean isCompleted() {
        return state == ScanState.COMPLETED;
    }
}
