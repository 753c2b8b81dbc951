package com.dmarket.arb.core;

import com.dmarket.arb.domain.Listing;
import com.dmarket.arb.domain.ListingPage;
import com.dmarket.arb.domain.Opportunity;
import com.dmarket.arb.domain.PriceSegment;
import com.dmarket.arb.domain.ScanCheckpoint;
import com.dmarket.arb.domain.ScanParameters;
import com.dmarket.arb.domain.ScanState;
import com.dmarket.arb.infra.ApiError;
import com.dmarket.arb.infra.ApiException;
import com.dmarket.arb.infra.CheckpointException;
import com.dmarket.arb.infra.CheckpointStore;
import com.dmarket.arb.infra.MarketApiClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one tier's scan: {@code STARTING -> PAGINATING -> COMPUTING -> COMPLETED | ABORTED}.
 *
 * <p>The tier's price range is cut into segments and each segment is paginated to the end (or to
 * the page limit) inside one batch item. Detectors that look at one listing at a time run per
 * segment; the rest run in COMPUTING over the listings every segment retained for them. The
 * checkpoint holds both for the completed prefix, so a resume never refetches it.
 */
@Slf4j
public class ArbitrageScanner {

    private final MarketApiClient marketApiClient;
    private final List<OpportunityDetector> detectors;
    private final LiquidityEnricher liquidityEnricher;
    private final OpportunityRanker ranker;
    private final BatchProcessor batchProcessor;
    private final BatchOptions batchOptions;
    private final CheckpointStore checkpointStore;
    private final Clock clock;

    public ArbitrageScanner(MarketApiClient marketApiClient, List<OpportunityDetector> detectors,
                            LiquidityEnricher liquidityEnricher, OpportunityRanker ranker, BatchProcessor batchProcessor,
                            BatchOptions batchOptions, CheckpointStore checkpointStore, Clock clock) {
        this.marketApiClient = marketApiClient;
        this.detectors = detectors;
        this.liquidityEnricher = liquidityEnricher;
        this.ranker = ranker;
        this.batchProcessor = batchProcessor;
        this.batchOptions = batchOptions;
        this.checkpointStore = checkpointStore;
        this.clock = clock;
    }

    public ScanOutcome scan(ScanParameters parameters, CancellationToken token) {
        String scanId = parameters.scanId();
        logState(scanId, ScanState.STARTING);
        List<PriceSegment> segments = PriceSegment.split(parameters.getPriceFrom(), parameters.getPriceTo(), parameters.getSegments());

        ScanCheckpoint resumed = findResumable(parameters, segments.size()).orElse(null);
        int startPosition = resumed != null ? resumed.resumePosition() : 0;
        List<Opportunity> carried = resumed != null ? resumed.getOpportunities() : List.of();
        List<Listing> carriedListings = resumed != null ? resumed.getRetainedListings() : List.of();
        long carriedItems = resumed != null ? resumed.getProcessedItems() : 0;
        if (resumed != null) {
            log.info("[SCAN] {} resuming at segment {}/{} with {} carried opportunity(ies)",
                    scanId, startPosition, segments.size(), carried.size());
        } else {
            saveQuietly(ScanCheckpoint.builder()
                    .scanId(scanId)
                    .cursor("0")
                    .processedItems(0)
                    .parameters(parameters)
                    .status(ScanCheckpoint.Status.IN_PROGRESS)
                    .updatedAt(clock.instant())
                    .build());
        }

        logState(scanId, ScanState.PAGINATING);
        BatchOptions options = batchOptions.toBuilder()
                .startOffset(startPosition)
                .abortOn(ArbitrageScanner::abortsTier)
                .build();
        BatchListener<SegmentResult> checkpointer = new BatchListener<>() {
            @Override
            public void onProgress(BatchProgress<SegmentResult> progress) {
                log.debug("[SCAN] {} segments done {}/{}, cursor {}", scanId,
                        progress.getSucceeded() + progress.getFailed(), progress.getTotal(), progress.getCursor());
            }

            @Override
            public void onCheckpoint(BatchProgress<SegmentResult> progress) {
                ScanCheckpoint.Status status = !progress.isFinalSnapshot() ? ScanCheckpoint.Status.IN_PROGRESS
                        : token.isCancelled() ? ScanCheckpoint.Status.INTERRUPTED : ScanCheckpoint.Status.FAILED;
                checkpointStore.save(checkpointOf(parameters, carried, carriedListings, carriedItems, progress, status));
            }
        };
        BatchResult<SegmentResult> batch = batchProcessor.run(
                segments.subList(startPosition, segments.size()),
                options,
                segment -> scanSegment(parameters, segment),
                checkpointer,
                token);

        ScanOutcome.ScanOutcomeBuilder outcome = ScanOutcome.builder()
                .scanId(scanId)
                .parameters(parameters)
                .resumed(resumed != null)
                .segmentsFailed(batch.getFailures().size());

        if (batch.isAborted()) {
            ApiError cause = batch.getAbortCause() instanceof ApiException apiException ? apiException.getError() : null;
            log.error("[SCAN] {} aborted at segment {}: {}", scanId, batch.getCursor(),
                    cause != null ? cause : batch.getAbortCause().toString());
            logState(scanId, ScanState.ABORTED);
            return outcome.state(ScanState.ABORTED).abortCause(cause).build();
        }
        if (batch.isCancelled()) {
            log.info("[SCAN] {} cancelled at segment {}, checkpoint kept for resume", scanId, batch.getCursor());
            logState(scanId, ScanState.ABORTED);
            return outcome.state(ScanState.ABORTED).cancelled(true).build();
        }

        logState(scanId, ScanState.COMPUTING);
        List<Opportunity> candidates = new ArrayList<>(carried);
        List<Listing> retained = new ArrayList<>(carriedListings);
        for (SegmentResult segment : batch.getSuccesses()) {
            candidates.addAll(segment.getCandidates());
            retained.addAll(segment.getRetainedListings());
        }
        candidates.addAll(detectAcrossSegments(retained, parameters));
        List<Opportunity> ranked = ranker.rank(liquidityEnricher.enrich(candidates, parameters), parameters.getMaxResults());

        try {
            checkpointStore.delete(scanId);
        } catch (CheckpointException e) {
            log.error("[CHECKPOINT] Could not delete checkpoint of completed scan {}: {}", scanId, e.getMessage());
        }
        logState(scanId, ScanState.COMPLETED);
        log.info("[SCAN] {} found {} opportunity(ies) from {} candidate(s), {} segment(s) failed",
                scanId, ranked.size(), candidates.size(), batch.getFailures().size());
        return outcome.state(ScanState.COMPLETED).opportunities(ranked).build();
    }

    /**
     * Paginates one segment. A segment that is running when the scan is cancelled still finishes;
     * only an interrupt from the drain timeout cuts it short, and that is reported as an interrupt
     * rather than a failed segment.
     */
    SegmentResult scanSegment(ScanParameters parameters, PriceSegment segment) throws InterruptedException {
        List<Listing> listings = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        ListingPage page;
        do {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while paginating segment " + segment.getPosition());
            }
            try {
                page = marketApiClient.getListings(parameters.getGameId(), segment.getPriceFrom(), segment.getPriceTo(),
                        parameters.getPageSize(), cursor).orElseThrow();
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    InterruptedException interrupted =
                            new InterruptedException("Interrupted while paginating segment " + segment.getPosition());
                    interrupted.initCause(e);
                    throw interrupted;
                }
                throw e;
            }
            listings.addAll(page.getListings());
            cursor = page.getNextCursor();
            pages++;
        } while (page.hasNext() && pages < parameters.getMaxPagesPerSegment());

        List<Opportunity> candidates = new ArrayList<>();
        List<Listing> retained = new ArrayList<>();
        for (OpportunityDetector detector : detectors) {
            if (detector.spansSegments()) {
                retained.addAll(detector.retain(listings));
            } else {
                candidates.addAll(detector.detect(listings, parameters));
            }
        }
        log.debug("[SCAN] Segment {} [{}-{}]: {} page(s), {} listing(s), {} candidate(s), {} retained", segment.getPosition(),
                segment.getPriceFrom(), segment.getPriceTo(), pages, listings.size(), candidates.size(), retained.size());
        return new SegmentResult(candidates, distinctById(retained), listings.size());
    }

    private List<Opportunity> detectAcrossSegments(List<Listing> retained, ScanParameters parameters) {
        List<Listing> listings = distinctById(retained);
        List<Opportunity> found = new ArrayList<>();
        for (OpportunityDetector detector : detectors) {
            if (detector.spansSegments()) {
                found.addAll(detector.detect(listings, parameters));
            }
        }
        return found;
    }

    // a live market can return the same offer on two consecutive pages
    private static List<Listing> distinctById(List<Listing> listings) {
        Map<String, Listing> byId = new LinkedHashMap<>();
        listings.forEach(listing -> byId.putIfAbsent(listing.getItemId(), listing));
        return new ArrayList<>(byId.values());
    }

    private Optional<ScanCheckpoint> findResumable(ScanParameters parameters, int segmentCount) {
        String scanId = parameters.scanId();
        Optional<ScanCheckpoint> stored;
        try {
            stored = checkpointStore.load(scanId);
        } catch (CheckpointException e) {
            log.error("[CHECKPOINT] Could not load {}, starting from zero: {}", scanId, e.getMessage());
            return Optional.empty();
        }
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        ScanCheckpoint checkpoint = stored.get();
        if (!parameters.equals(checkpoint.getParameters())) {
            log.info("[CHECKPOINT] Discarding {}: scan parameters changed", scanId);
            return Optional.empty();
        }
        int position;
        try {
            position = checkpoint.resumePosition();
        } catch (NumberFormatException e) {
            log.warn("[CHECKPOINT] Discarding {}: unreadable cursor '{}'", scanId, checkpoint.getCursor());
            return Optional.empty();
        }
        if (position < 0 || position > segmentCount) {
            log.warn("[CHECKPOINT] Discarding {}: cursor {} outside 0..{}", scanId, position, segmentCount);
            return Optional.empty();
        }
        return stored;
    }

    private ScanCheckpoint checkpointOf(ScanParameters parameters, List<Opportunity> carried, List<Listing> carriedListings,
                                        long carriedItems, BatchProgress<SegmentResult> progress, ScanCheckpoint.Status status) {
        List<Opportunity> opportunities = new ArrayList<>(carried);
        List<Listing> retained = new ArrayList<>(carriedListings);
        long processed = carriedItems;
        for (SegmentResult segment : progress.getCompletedPrefix()) {
            opportunities.addAll(segment.getCandidates());
            retained.addAll(segment.getRetainedListings());
            processed += segment.getListingsScanned();
        }
        return ScanCheckpoint.builder()
                .scanId(parameters.scanId())
                .cursor(Integer.toString(progress.getCursor()))
                .processedItems(processed)
                .parameters(parameters)
                .opportunities(opportunities)
                .retainedListings(distinctById(retained))
                .status(status)
                .updatedAt(clock.instant())
                .build();
    }

    private void saveQuietly(ScanCheckpoint checkpoint) {
        try {
            checkpointStore.save(checkpoint);
        } catch (CheckpointException e) {
            log.error("[CHECKPOINT] Could not save {}, continuing without resume point: {}", checkpoint.getScanId(), e.getMessage());
        }
    }

    private static boolean abortsTier(Throwable error) {
        return error instanceof ApiException apiException
                && (apiException.getError().is(ApiError.Kind.CLIENT_ERROR) || apiException.getError().is(ApiError.Kind.CIRCUIT_OPEN));
    }

    private static void logState(String scanId, ScanState state) {
        log.info("[SCAN] {} -> {}", scanId, state);
    }
}
