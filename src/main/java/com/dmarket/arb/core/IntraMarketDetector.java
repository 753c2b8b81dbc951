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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Same title listed at different prices: buy the cheapest copy and relist it at the price of the
 * next cheapest one. Copies of a title can sit in different price segments, so this runs over the
 * whole tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntraMarketDetector implements OpportunityDetector {

    private final ProfitCalculator profitCalculator;
    private final Clock clock;

    private static final Comparator<Listing> CHEAPEST_FIRST =
            Comparator.comparingLong(Listing::getPrice).thenComparing(Listing::getItemId);

    @Override
    public boolean spansSegments() {
        return true;
    }

    /** Keeps the two cheapest copies of each title; nothing else can form a pair later. */
    @Override
    public List<Listing> retain(List<Listing> segmentListings) {
        Map<String, List<Listing>> byTitle = groupByTitle(segmentListings);
        List<Listing> retained = new ArrayList<>();
        for (List<Listing> sameTitle : byTitle.values()) {
            sameTitle.sort(CHEAPEST_FIRST);
            retained.addAll(sameTitle.subList(0, Math.min(2, sameTitle.size())));
        }
        return retained;
    }

    @Override
    public List<Opportunity> detect(List<Listing> listings, ScanParameters parameters) {
        Map<String, List<Listing>> byTitle = groupByTitle(listings);

        List<Opportunity> opportunities = new ArrayList<>();
        for (List<Listing> sameTitle : byTitle.values()) {
            if (sameTitle.size() < 2) {
                continue;
            }
            sameTitle.sort(CHEAPEST_FIRST);
            Listing cheapest = sameTitle.get(0);
            Listing next = sameTitle.get(1);

            ProfitCalculator.Evaluation evaluation =
                    profitCalculator.evaluate(cheapest.getPrice(), next.getPrice(), parameters.getCommissionRate());
            if (!profitCalculator.meetsThresholds(evaluation, parameters.getMinProfit(), parameters.getMinProfitPercent())) {
                continue;
            }
            opportunities.add(Opportunity.builder()
                    .id(Opportunity.Type.INTRA_MARKET + ":" + cheapest.getItemId() + ":" + next.getItemId())
                    .type(Opportunity.Type.INTRA_MARKET)
                    .gameId(cheapest.getGameId())
                    .title(cheapest.getTitle())
                    .buyItemId(cheapest.getItemId())
                    .sellItemId(next.getItemId())
                    .buyPrice(cheapest.getPrice())
                    .sellPrice(next.getPrice())
                    .profit(evaluation.getProfit())
                    .profitPercent(evaluation.getProfitPercent())
                    .commissionRate(parameters.getCommissionRate())
                    .liquidityScore(LiquidityEnricher.salesScore(cheapest.getRecentSales()))
                    .riskLevel(RiskLevel.forProfitPercent(evaluation.getProfitPercent()))
                    .detectedAt(clock.instant())
                    .build());
        }
        log.debug("[SCAN] Intra-market: {} candidate(s) from {} title(s)", opportunities.size(), byTitle.size());
        return opportunities;
    }

    private static Map<String, List<Listing>> groupByTitle(List<Listing> listings) {
        Map<String, List<Listing>> byTitle = new LinkedHashMap<>();
        for (Listing listing : listings) {
            if (listing.getPrice() > 0) {
                byTitle.computeIfAbsent(listing.getTitle(), k -> new ArrayList<>()).add(listing);
            }
        }
        return byTitle;
    }
}
