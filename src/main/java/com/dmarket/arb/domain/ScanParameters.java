package com.dmarket.arb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Immutable inputs of one scan run. Resolved at scan start, stored in the checkpoint and
 * compared on resume.
 */
@Value
@Builder
@Jacksonized
public class ScanParameters {
    String gameId;
    String tierName;
    long priceFrom;
    long priceTo;
    BigDecimal commissionRate;
    long minProfit;
    BigDecimal minProfitPercent;
    int pageSize;
    int maxPagesPerSegment;
    int segments;
    boolean liquidityFilter;
    int minLiquidityScore;
    int maxResults;

    public String scanId() {
        return "scan:" + gameId + ":" + tierName;
    }
}
