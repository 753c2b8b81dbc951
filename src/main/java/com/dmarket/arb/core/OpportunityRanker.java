package com.dmarket.arb.core;

import com.dmarket.arb.domain.Opportunity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Best first: profit percentage descending, then absolute profit descending, then id for a stable
 * order. Each item is bought at most once.
 *
 * <p>The percentage is compared as the exact ratio {@code profit / buyPrice}; the rounded
 * {@link Opportunity#getProfitPercent()} is for display only.
 */
@Component
public class OpportunityRanker {

    static final Comparator<Opportunity> BY_RATIO_DESCENDING = (a, b) -> Long.compare(
            Math.multiplyExact(b.getProfit(), a.getBuyPrice()),
            Math.multiplyExact(a.getProfit(), b.getBuyPrice()));

    static final Comparator<Opportunity> RANKING = BY_RATIO_DESCENDING
            .thenComparing(Opportunity::getProfit, Comparator.reverseOrder())
            .thenComparing(Opportunity::getId);

    public List<Opportunity> rank(List<Opportunity> candidates, int maxResults) {
        List<Opportunity> sorted = new ArrayList<>(candidates);
        sorted.sort(RANKING);
        List<Opportunity> ranked = new ArrayList<>();
        Set<String> boughtItems = new HashSet<>();
        for (Opportunity opportunity : sorted) {
            if (ranked.size() >= maxResults) {
                break;
            }
            if (boughtItems.add(opportunity.getBuyItemId())) {
                ranked.add(opportunity);
            }
        }
        return ranked;
    }
}
