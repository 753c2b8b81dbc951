package com.dmarket.arb.core;

import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.RiskLevel;
import com.dmarket.arb.domain.ScanParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Buy a listing, resell at the marketplace's suggested price for that item.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferencePriceDetector implements OpportunityDetector {

    private final ProfitCalculator profitCalculator;
    private final Clock clock;

    @Override
    public List<Opportunity> detect(List<Listing> listings, ScanParameters parameters) {
        List<Opportunity> opportunities = new ArrayList<>();
        for (Listing listing : listings) {
            if (!listing.hasSuggestedPrice() || listing.getPrice() <= 0) {
                continue;
            }
            ProfitCalculator.Evaluation evaluation =
                    profitCalculator.evaluate(listing.getPrice(), listing.getSuggestedPrice(), parameters.getCommissionRate());
            if (!profitCalculator.meetsThresholds(evaluation, parameters.getMinProfit(), parameters.getMinProfitPercent())) {
                continue;
            }
            opportunities.add(Opportunity.builder()
                    .id(Opportunity.Type.REFERENCE_PRICE + ":" + listing.getItemId())
                    .type(Opportunity.Type.REFERENCE_PRICE)
                    .gameId(listing.getGameId())
                    .title(listing.getTitle())
                    .buyItemId(listing.getItemId())
                    .buyPrice(listing.getPrice())
                    .sellPrice(listing.getSuggestedPrice())
                    .profit(evaluation.getProfit())
                    .profitPercent(evaluation.getProfitPercent())
                    .commissionRate(parameters.getCommissionRate())
                    .liquidityScore(LiquidityEnricher.salesScore(listing.getRecentSales()))
                    .riskLevel(RiskLevel.forProfitPercent(evaluation.getProfitPercent()))
                    .detectedAt(clock.instant())
                    .build());
        }
        log.debug("[SCAN] Reference price: {} candidate(s) from {} listing(s)", opportunities.size(), listings.size());
        return opportunities;
    }
}
