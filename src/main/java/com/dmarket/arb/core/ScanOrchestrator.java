package com.dmarket.arb.core;

import com.dmarket.arb.config.ScannerProperties;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.ScanParameters;
import com.dmarket.arb.domain.ScanState;
import com.dmarket.arb.infra.CheckpointException;
import com.dmarket.arb.infra.CheckpointStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduled outer loop: one scan run per configured (game, tier), one after another. A tier that
 * fails or aborts does not stop the remaining tiers; cancellation does.
 *
 * <p>On shutdown the active cycle is cancelled and waited for, so in-flight segments drain and the
 * final checkpoint is written before the worker pool goes away.
 */
@Slf4j
@Service
public class ScanOrchestrator {

    private final ArbitrageScanner scanner;
    private final ScannerProperties properties;
    private final CheckpointStore checkpointStore;
    private final List<OpportunityListener> listeners;
    private final Executor notificationExecutor;
    private final ScanStatistics statistics;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile CancellationToken activeToken;
    private volatile boolean shuttingDown;

    public ScanOrchestrator(ArbitrageScanner scanner, ScannerProperties properties, CheckpointStore checkpointStore,
                            List<OpportunityListener> listeners,
                            @Qualifier("notificationExecutor") Executor notificationExecutor,
                            ScanStatistics statistics) {
        this.scanner = scanner;
        this.properties = properties;
        this.checkpointStore = checkpointStore;
        this.listeners = listeners;
        this.notificationExecutor = notificationExecutor;
        this.statistics = statistics;
    }

    @Scheduled(initialDelayString = "${scanner.scan.initial-delay:PT10S}", fixedDelayString = "${scanner.scan.interval:PT5M}")
    public void scheduledScan() {
        if (!properties.getScan().isEnabled()) {
            log.debug("[SCAN] Scanning disabled, skipping cycle");
            return;
        }
        runCycle();
    }

    public List<ScanOutcome> runCycle() {
        if (shuttingDown) {
            return List.of();
        }
        if (!cycleLock.tryLock()) {
            log.warn("[SCAN] Previous cycle still running, skipping");
            return List.of();
        }
        CancellationToken token = new CancellationToken();
        activeToken = token;
        try {
            if (shuttingDown) {
                return List.of();
            }
            statistics.recordCycle();
            List<ScanOutcome> outcomes = new ArrayList<>();
            for (String gameId : properties.getScan().getGames()) {
                for (ScannerProperties.Tier tier : properties.getScan().getTiers()) {
                    if (token.isCancelled()) {
                        log.info("[SCAN] Cycle cancelled, remaining tiers skipped");
                        return outcomes;
                    }
                    outcomes.add(runTier(properties.getScan().parametersFor(gameId, tier), token));
                }
            }
            long completed = outcomes.stream().filter(ScanOutcome::isCompleted).count();
            log.info("[SCAN] Cycle finished: {}/{} tier(s) completed", completed, outcomes.size());
            return outcomes;
        } finally {
            activeToken = null;
            cycleLock.unlock();
        }
    }

    ScanOutcome runTier(ScanParameters parameters, CancellationToken token) {
        ScanOutcome outcome;
        try {
            outcome = scanner.scan(parameters, token);
        } catch (RuntimeException e) {
            log.error("[SCAN] Tier {} of {} failed unexpectedly", parameters.getTierName(), parameters.getGameId(), e);
            statistics.recordAborted();
            return ScanOutcome.builder()
                    .scanId(parameters.scanId())
                    .parameters(parameters)
                    .state(ScanState.ABORTED)
                    .build();
        }
        statistics.record(outcome);
        if (outcome.isCompleted()) {
            publish(parameters, outcome.getOpportunities());
        }
        return outcome;
    }

    private void publish(ScanParameters parameters, List<Opportunity> ranked) {
        for (OpportunityListener listener : listeners) {
            try {
                notificationExecutor.execute(() -> {
                    try {
                        listener.onOpportunities(parameters, ranked);
                    } catch (RuntimeException e) {
                        log.error("[SCAN] Listener {} failed", listener.getClass().getSimpleName(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("[SCAN] Notification for {} dropped: {}", parameters.scanId(), e.getMessage());
            }
        }
    }

    @Scheduled(initialDelayString = "${scanner.checkpoint.purge-initial-delay:PT1M}", fixedDelayString = "${scanner.checkpoint.purge-interval:PT1H}")
    public void purgeCheckpoints() {
        try {
            int purged = checkpointStore.purgeOlderThan(properties.getCheckpoint().getRetention());
            if (purged > 0) {
                log.info("[CHECKPOINT] Purged {} checkpoint(s) older than {}", purged, properties.getCheckpoint().getRetention());
            }
        } catch (CheckpointException e) {
            log.error("[CHECKPOINT] Purge failed: {}", e.getMessage());
        }
    }

    public ScanStatistics.Snapshot statistics() {
        return statistics.snapshot();
    }

    /**
     * Cancels the active cycle and waits for it to return, at most the drain timeout plus one call
     * timeout.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        CancellationToken token = activeToken;
        if (token == null) {
            return;
        }
        log.info("[SCAN] Shutdown requested, cancelling active scan");
        token.cancel();

        Duration bound = properties.getBatch().getDrainTimeout().plus(properties.getApi().getCallTimeout());
        try {
            if (cycleLock.tryLock(bound.toMillis(), TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
                log.info("[SCAN] Active scan stopped, checkpoint written");
            } else {
                log.warn("[SCAN] Active scan still running after {}, shutting down without it", bound);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SCAN] Interrupted while waiting for the active scan to stop");
        }
    }
}
