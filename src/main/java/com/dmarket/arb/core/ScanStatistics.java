package com.dmarket.arb.core;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Running totals since process start. */
@Component
public class ScanStatistics {

    private final Clock clock;
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong tiersCompleted = new AtomicLong();
    private final AtomicLong tiersAborted = new AtomicLong();
    private final AtomicLong tiersCancelled = new AtomicLong();
    private final AtomicLong tiersResumed = new AtomicLong();
    private final AtomicLong opportunitiesFound = new AtomicLong();
    private final AtomicReference<Instant> lastCompletedAt = new AtomicReference<>();

    public ScanStatistics(Clock clock) {
        this.clock = clock;
    }

    public void recordCycle() {
        cycles.incrementAndGet();
    }

    public void record(ScanOutcome outcome) {
        if (outcome.isResumed()) {
            tiersResumed.incrementAndGet();
        }
        if (outcome.isCompleted()) {
            tiersCompleted.incrementAndGet();
            opportunitiesFound.addAndGet(outcome.getOpportunities().size());
            lastCompletedAt.set(clock.instant());
        } else if (outcome.isCancelled()) {
            tiersCancelled.incrementAndGet();
        } else {
            tiersAborted.incrementAndGet();
        }
    }

    public void recordAborted() {
        tiersAborted.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(cycles.get(), tiersCompleted.get(), tiersAborted.get(), tiersCancelled.get(),
                tiersResumed.get(), opportunitiesFound.get(), lastCompletedAt.get());
    }

    @Value
    public static class Snapshot {
        long cycles;
        long tiersCompleted;
        long tiersAborted;
        long tiersCancelled;
        long tiersResumed;
        long opportunitiesFound;
        Instant lastCompletedAt;
    }
}
