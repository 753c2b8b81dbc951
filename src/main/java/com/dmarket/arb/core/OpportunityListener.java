package com.dmarket.arb.core;

import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;

import java.util.List;

/**
 * Receives the ranked result of every completed tier. Invoked off the scan thread; the scan never
 * waits for it.
 */
public interface OpportunityListener {

    void onOpportunities(ScanParameters parameters, List<Opportunity> ranked);
}
