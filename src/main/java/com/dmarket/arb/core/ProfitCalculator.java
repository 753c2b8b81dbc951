package com.dmarket.arb.core;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Net profit of buying at one price and reselling at another, all amounts in cents.
 * The marketplace commission is charged on the sale price and rounded half-up to a whole cent.
 */
@Component
public class ProfitCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Evaluation evaluate(long buyPrice, long sellPrice, BigDecimal commissionRate) {
        if (buyPrice <= 0) {
            throw new IllegalArgumentException("buyPrice must be positive: " + buyPrice);
        }
        long commission = BigDecimal.valueOf(sellPrice)
                .multiply(commissionRate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        long profit = sellPrice - buyPrice - commission;
        BigDecimal profitPercent = BigDecimal.valueOf(profit)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(buyPrice), 2, RoundingMode.HALF_UP);
        return new Evaluation(buyPrice, commission, profit, profitPercent);
    }

    /**
     * Profit must be positive, at least {@code minProfit} cents and at least
     * {@code minProfitPercent} of the buy price. The percentage test is exact, not on the rounded
     * figure.
     */
    public boolean meetsThresholds(Evaluation evaluation, long minProfit, BigDecimal minProfitPercent) {
        if (evaluation.getProfit() <= 0 || evaluation.getProfit() < minProfit) {
            return false;
        }
        BigDecimal scaledProfit = BigDecimal.valueOf(evaluation.getProfit()).multiply(HUNDRED);
        return scaledProfit.compareTo(minProfitPercent.multiply(BigDecimal.valueOf(evaluation.getBuyPrice()))) >= 0;
    }

    @Value
    public static class Evaluation {
        long buyPrice;
        long commission;
        long profit;
        BigDecimal profitPercent;
    }
}
