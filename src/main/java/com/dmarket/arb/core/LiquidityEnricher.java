package com.dmarket.arb.core;

import com.dmarket.arb.domain.AggregatedPrice;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;
import com.dmarket.arb.infra.ApiResult;
import com.dmarket.arb.infra.MarketApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the sale-count liquidity estimate with market depth from aggregated prices and applies
 * the liquidity filter. A failed lookup keeps the estimates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiquidityEnricher {

    private final MarketApiClient marketApiClient;

    public List<Opportunity> enrich(List<Opportunity> candidates, ScanParameters parameters) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        List<String> titles = candidates.stream().map(Opportunity::getTitle).distinct().toList();
        ApiResult<Map<String, AggregatedPrice>> lookup = marketApiClient.getAggregatedPrices(parameters.getGameId(), titles);
        Map<String, AggregatedPrice> depth = Map.of();
        if (lookup.isSuccess()) {
            depth = lookup.getValue();
        } else {
            log.warn("[SCAN] Liquidity lookup for {} title(s) failed, using sale counts: {}", titles.size(), lookup.getError());
        }

        List<Opportunity> enriched = new ArrayList<>(candidates.size());
        for (Opportunity candidate : candidates) {
            AggregatedPrice aggregated = depth.get(candidate.getTitle());
            Opportunity opportunity = aggregated == null
                    ? candidate
                    : candidate.toBuilder().liquidityScore(aggregated.liquidityScore()).build();
            if (parameters.isLiquidityFilter()
                    && opportunity.getLiquidityScore() != null
                    && opportunity.getLiquidityScore() < parameters.getMinLiquidityScore()) {
                continue;
            }
            enriched.add(opportunity);
        }
        return enriched;
    }

    static Integer salesScore(Integer recentSales) {
        return recentSales == null ? null : Math.min(100, recentSales * 2);
    }
}
