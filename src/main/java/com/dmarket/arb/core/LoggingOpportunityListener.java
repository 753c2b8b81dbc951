package com.dmarket.arb.core;

import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class LoggingOpportunityListener implements OpportunityListener {

    private static final int TOP = 5;

    @Override
    public void onOpportunities(ScanParameters parameters, List<Opportunity> ranked) {
        if (ranked.isEmpty()) {
            log.info("[SCAN] {} / {}: no opportunities", parameters.getGameId(), parameters.getTierName());
            return;
        }
        log.info("[SCAN] {} / {}: {} opportunity(ies), top {}", parameters.getGameId(), parameters.getTierName(),
                ranked.size(), Math.min(TOP, ranked.size()));
        ranked.stream().limit(TOP).forEach(o -> log.info("  {} '{}' buy {} sell {} profit {} ({}%) liquidity {} risk {}",
                o.getType(), o.getTitle(), o.getBuyPrice(), o.getSellPrice(), o.getProfit(), o.getProfitPercent(),
                o.getLiquidityScore() != null ? o.getLiquidityScore() : "-", o.getRiskLevel()));
    }
}
