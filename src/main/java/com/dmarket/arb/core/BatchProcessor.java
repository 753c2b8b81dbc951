package com.dmarket.arb.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs items in chunks on a shared worker pool with at most {@code maxConcurrency} chunks in
 * flight. Items inside a chunk run in order on one worker.
 *
 * <p>Per-item exceptions are collected, never propagated. Once the token is cancelled no further
 * chunk is dispatched and chunks already running finish their items; anything still running after
 * {@code drainTimeout} is interrupted. An {@code abortOn} failure also stops running chunks before
 * their next item.
 */
@Slf4j
public class BatchProcessor {

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ExecutorService workers;
    private final Clock clock;

    public BatchProcessor(ExecutorService workers, Clock clock) {
        this.workers = workers;
        this.clock = clock;
    }

    public <T, R> BatchResult<R> run(List<T> items, BatchOptions options, ItemProcessor<T, R> processor,
                                     BatchListener<R> listener, CancellationToken token) {
        if (options.getChunkSize() <= 0 || options.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("chunkSize and maxConcurrency must be positive: " + options);
        }
        return new Run<>(items, options, processor, listener, token).execute();
    }

    private final class Run<T, R> {
        private final List<T> items;
        private final BatchOptions options;
        private final ItemProcessor<T, R> processor;
        private final BatchListener<R> listener;
        private final CancellationToken token;
        private final Semaphore slots;

        private final Object stateLock = new Object();
        private final Object checkpointLock = new Object();
        private final List<R> results;
        private final boolean[] succeeded;
        private final List<BatchFailure> failures = new ArrayList<>();
        private int successCount;
        private int localCursor;

        private int processedAtLastCheckpoint;
        private Instant lastCheckpointAt;

        private final AtomicReference<Throwable> abortCause = new AtomicReference<>();
        private volatile boolean interrupted;
        private volatile boolean closed;

        Run(List<T> items, BatchOptions options, ItemProcessor<T, R> processor, BatchListener<R> listener,
            CancellationToken token) {
            this.items = items;
            this.options = options;
            this.processor = processor;
            this.listener = listener;
            this.token = token;
            this.slots = new Semaphore(options.getMaxConcurrency());
            this.results = new ArrayList<>(Collections.nCopies(items.size(), null));
            this.succeeded = new boolean[items.size()];
        }

        BatchResult<R> execute() {
            lastCheckpointAt = clock.instant();
            int chunkSize = options.getChunkSize();
            log.info("[BATCH] Starting {} item(s) from position {} in chunks of {}, concurrency {}",
                    items.size(), options.getStartOffset(), chunkSize, options.getMaxConcurrency());

            List<Future<?>> inFlight = new ArrayList<>();
            for (int from = 0; from < items.size(); from += chunkSize) {
                if (stopRequested() || !awaitSlot()) {
                    break;
                }
                int start = from;
                int end = Math.min(items.size(), from + chunkSize);
                try {
                    inFlight.add(workers.submit(() -> runChunk(start, end)));
                } catch (RejectedExecutionException e) {
                    slots.release();
                    log.error("[BATCH] Worker pool rejected chunk at position {}", options.getStartOffset() + start, e);
                    abortCause.compareAndSet(null, e);
                    break;
                }
            }
            drain(inFlight);

            closed = true;
            boolean cancelled = token.isCancelled() || interrupted;
            if (cancelled || abortCause.get() != null) {
                checkpoint(true);
            }

            BatchResult<R> result;
            synchronized (stateLock) {
                List<R> successes = new ArrayList<>(successCount);
                for (int i = 0; i < succeeded.length; i++) {
                    if (succeeded[i]) {
                        successes.add(results.get(i));
                    }
                }
                int skipped = items.size() - successCount - failures.size();
                result = new BatchResult<>(successes, new ArrayList<>(failures), skipped,
                        options.getStartOffset() + localCursor, cancelled, abortCause.get());
            }
            log.info("[BATCH] Finished: {} succeeded, {} failed, {} skipped, cursor {}{}",
                    result.getSuccesses().size(), result.getFailures().size(), result.getSkipped(), result.getCursor(),
                    cancelled ? " (cancelled)" : result.isAborted() ? " (aborted)" : "");
            return result;
        }

        private boolean stopRequested() {
            return token.isCancelled() || abortCause.get() != null || interrupted;
        }

        private boolean awaitSlot() {
            try {
                while (!slots.tryAcquire(POLL_NANOS, TimeUnit.NANOSECONDS)) {
                    if (stopRequested()) {
                        return false;
                    }
                }
                if (stopRequested()) {
                    slots.release();
                    return false;
                }
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                return false;
            }
        }

        private void runChunk(int start, int end) {
            try {
                for (int i = start; i < end; i++) {
                    if (abortCause.get() != null || Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    if (!processItem(i)) {
                        break;
                    }
                }
                log.debug("[BATCH] Chunk [{}, {}) done", options.getStartOffset() + start, options.getStartOffset() + end);
                BatchProgress<R> progress = snapshot(false);
                try {
                    listener.onProgress(progress);
                } catch (RuntimeException e) {
                    log.warn("[BATCH] Progress callback failed: {}", e.getMessage());
                }
                checkpoint(false);
            } finally {
                slots.release();
            }
        }

        /** Returns false when the worker was interrupted and the chunk must stop. */
        private boolean processItem(int index) {
            int position = options.getStartOffset() + index;
            try {
                R result = processor.process(items.get(index));
                synchronized (stateLock) {
                    results.set(index, result);
                    succeeded[index] = true;
                    successCount++;
                    while (localCursor < succeeded.length && succeeded[localCursor]) {
                        localCursor++;
                    }
                }
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[BATCH] Item {} interrupted", position);
                return false;
            } catch (Exception e) {
                synchronized (stateLock) {
                    failures.add(new BatchFailure(position, e));
                }
                log.warn("[BATCH] Item {} failed: {}", position, e.getMessage());
                if (options.getAbortOn().test(e) && abortCause.compareAndSet(null, e)) {
                    log.warn("[BATCH] Stopping dispatch after item {}: {}", position, e.getMessage());
                }
                return true;
            }
        }

        private void checkpoint(boolean force) {
            if (closed && !force) {
                return;
            }
            synchronized (checkpointLock) {
                BatchProgress<R> progress;
                synchronized (stateLock) {
                    int processed = successCount + failures.size();
                    boolean due = force
                            || processed - processedAtLastCheckpoint >= options.getCheckpointEveryItems()
                            || !Duration.between(lastCheckpointAt, clock.instant()).minus(options.getCheckpointInterval()).isNegative();
                    if (!due) {
                        return;
                    }
                    progress = snapshot(force);
                }
                try {
                    listener.onCheckpoint(progress);
                    processedAtLastCheckpoint = progress.getSucceeded() + progress.getFailed();
                    lastCheckpointAt = clock.instant();
                } catch (RuntimeException e) {
                    log.error("[BATCH] Checkpoint at cursor {} failed, retrying at next chunk: {}",
                            progress.getCursor(), e.getMessage());
                }
            }
        }

        private BatchProgress<R> snapshot(boolean finalSnapshot) {
            synchronized (stateLock) {
                return new BatchProgress<>(options.getStartOffset() + localCursor, successCount, failures.size(),
                        items.size(), new ArrayList<>(results.subList(0, localCursor)), finalSnapshot);
            }
        }

        private void drain(List<Future<?>> inFlight) {
            long drainDeadline = 0;
            boolean draining = false;
            for (Future<?> future : inFlight) {
                while (true) {
                    if (!draining && stopRequested()) {
                        draining = true;
                        drainDeadline = System.nanoTime() + options.getDrainTimeout().toNanos();
                    }
                    long wait = POLL_NANOS;
                    if (draining) {
                        long remaining = drainDeadline - System.nanoTime();
                        if (remaining <= 0) {
                            log.warn("[BATCH] Drain timeout of {} exceeded, interrupting running chunks", options.getDrainTimeout());
                            inFlight.forEach(f -> f.cancel(true));
                            return;
                        }
                        wait = Math.min(wait, remaining);
                    }
                    try {
                        if (awaitDone(future, wait)) {
                            break;
                        }
                    } catch (ExecutionException e) {
                        log.error("[BATCH] Chunk task failed unexpectedly", e.getCause());
                        break;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interrupted = true;
                        inFlight.forEach(f -> f.cancel(true));
                        return;
                    }
                }
            }
        }

        private boolean awaitDone(Future<?> future, long nanos) throws ExecutionException, InterruptedException {
            try {
                future.get(nanos, TimeUnit.NANOSECONDS);
                return true;
            } catch (TimeoutException e) {
                return false;
            }
        }
    }
}
