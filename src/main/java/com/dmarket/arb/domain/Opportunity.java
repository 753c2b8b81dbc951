package com.dmarket.arb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Opportunity {
    String id;
    Type type;
    String gameId;
    String title;

    String buyItemId;
    String sellItemId; // counter-listing for INTRA_MARKET, null otherwise

    // Summary metrics, all prices in cents
    long buyPrice;
    long sellPrice;
    long profit;
    BigDecimal profitPercent;
    BigDecimal commissionRate;

    Integer liquidityScore; // null when no liquidity data was available
    RiskLevel riskLevel;
    Instant detectedAt;

    public enum Type {
        REFERENCE_PRICE, // listing price vs suggested price
        INTRA_MARKET // cheapest listing vs next cheapest of the same title
    }
}
