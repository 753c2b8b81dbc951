package com.dmarket.arb.domain;

import java.math.BigDecimal;

public enum RiskLevel {
    LOW, MEDIUM, HIGH;

    private static final BigDecimal HIGH_FROM = new BigDecimal("20");
    private static final BigDecimal MEDIUM_FROM = new BigDecimal("10");

    public static RiskLevel forProfitPercent(BigDecimal profitPercent) {
        if (profitPercent.compareTo(HIGH_FROM) >= 0) {
            return HIGH;
        }
        if (profitPercent.compareTo(MEDIUM_FROM) >= 0) {
            return MEDIUM;
        }
        return LOW;
    }
}
