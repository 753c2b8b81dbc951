package com.dmarket.arb.core;

import com.dmarket.arb.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    private ExecutorService workers;
    private MutableClock clock;
    private BatchProcessor processor;
    private final CancellationToken token = new CancellationToken();

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(4);
        clock = MutableClock.atEpoch();
        processor = new BatchProcessor(workers, clock);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private static List<Integer> items(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    private static BatchOptions.BatchOptionsBuilder options() {
        return BatchOptions.builder()
                .checkpointEveryItems(1_000)
                .checkpointInterval(Duration.ofHours(1))
                .drainTimeout(Duration.ofSeconds(5));
    }

    /** Collects every checkpoint the run emits. */
    private static class RecordingListener implements BatchListener<Integer> {
        final List<BatchProgress<Integer>> checkpoints = new CopyOnWriteArrayList<>();

        @Override
        public void onCheckpoint(BatchProgress<Integer> progress) {
            checkpoints.add(progress);
        }

        List<Integer> cursors() {
            return checkpoints.stream().map(BatchProgress::getCursor).collect(Collectors.toList());
        }
    }

    @Test
    void failingItemsAreCollectedAndTheRestSucceed() {
        BatchResult<Integer> result = processor.run(items(100), options().build(), item -> {
            if (item == 10 || item == 55) {
                throw new IllegalStateException("boom " + item);
            }
            return item * 2;
        }, new RecordingListener(), token);

        assertEquals(98, result.getSuccesses().size());
        assertEquals(List.of(10, 55), result.getFailures().stream().map(BatchFailure::getPosition).collect(Collectors.toList()));
        assertEquals(0, result.getSkipped());
        assertEquals(10, result.getCursor(), "cursor stops at the first failed position");
        assertEquals(0, result.getSuccesses().get(0));
        assertEquals(198, result.getSuccesses().get(97));
        assertFalse(result.isCancelled());
        assertFalse(result.isComplete());
    }

    @Test
    void allSuccessesCompleteTheBatch() {
        BatchResult<Integer> result = processor.run(items(20), options().chunkSize(3).build(), item -> item,
                new RecordingListener(), token);

        assertTrue(result.isComplete());
        assertEquals(items(20), result.getSuccesses());
        assertEquals(20, result.getCursor());
    }

    @Test
    void positionsAreAbsoluteWhenResuming() {
        BatchResult<Integer> result = processor.run(items(5), options().startOffset(7).build(), item -> {
            if (item == 2) {
                throw new IllegalStateException("boom");
            }
            return item;
        }, new RecordingListener(), token);

        assertEquals(9, result.getFailures().get(0).getPosition());
        assertEquals(9, result.getCursor());
    }

    @Test
    void cancellationStopsDispatchPromptly() {
        AtomicInteger attempted = new AtomicInteger();
        RecordingListener listener = new RecordingListener();

        BatchResult<Integer> result = processor.run(items(100), options().maxConcurrency(2).build(), item -> {
            attempted.incrementAndGet();
            if (item == 3) {
                token.cancel();
            }
            return item;
        }, listener, token);

        assertTrue(result.isCancelled());
        assertTrue(attempted.get() <= 4 + 2, "attempted " + attempted.get());
        assertEquals(100, result.getSuccesses().size() + result.getFailures().size() + result.getSkipped());
        BatchProgress<Integer> last = listener.checkpoints.get(listener.checkpoints.size() - 1);
        assertTrue(last.isFinalSnapshot());
        assertEquals(result.getCursor(), last.getCursor());
    }

    @Test
    void runningChunkFinishesAfterCancellation() {
        RecordingListener listener = new RecordingListener();

        BatchResult<Integer> result = processor.run(items(10), options().chunkSize(5).maxConcurrency(1).build(), item -> {
            if (item == 1) {
                token.cancel();
            }
            return item;
        }, listener, token);

        assertTrue(result.isCancelled());
        assertEquals(items(5), result.getSuccesses());
        assertEquals(5, result.getSkipped());
        assertEquals(5, result.getCursor());
        BatchProgress<Integer> last = listener.checkpoints.get(listener.checkpoints.size() - 1);
        assertTrue(last.isFinalSnapshot());
        assertEquals(5, last.getCursor());
    }

    @Test
    void abortingFailureStopsFurtherChunks() {
        RecordingListener listener = new RecordingListener();
        BatchOptions options = options()
                .maxConcurrency(1)
                .abortOn(error -> error instanceof IllegalArgumentException)
                .build();

        BatchResult<Integer> result = processor.run(items(100), options, item -> {
            if (item == 4) {
                throw new IllegalArgumentException("bad request");
            }
            return item;
        }, listener, token);

        assertTrue(result.isAborted());
        assertInstanceOf(IllegalArgumentException.class, result.getAbortCause());
        assertEquals(4, result.getSuccesses().size());
        assertEquals(95, result.getSkipped());
        assertEquals(4, result.getCursor());
        assertTrue(listener.checkpoints.get(listener.checkpoints.size() - 1).isFinalSnapshot());
    }

    @Test
    void nonAbortingFailuresKeepGoing() {
        BatchResult<Integer> result = processor.run(items(10), options().build(), item -> {
            throw new IllegalStateException("always");
        }, new RecordingListener(), token);

        assertFalse(result.isAborted());
        assertEquals(10, result.getFailures().size());
        assertEquals(0, result.getCursor());
    }

    @Test
    void checkpointsFollowItemCadence() {
        RecordingListener listener = new RecordingListener();

        processor.run(items(35), options().maxConcurrency(1).checkpointEveryItems(10).build(), item -> item, listener, token);

        assertEquals(List.of(10, 20, 30), listener.cursors());
        assertEquals(items(10), listener.checkpoints.get(0).getCompletedPrefix());
        assertFalse(listener.checkpoints.get(2).isFinalSnapshot());
    }

    @Test
    void checkpointsFollowTimeCadence() {
        RecordingListener listener = new RecordingListener();

        processor.run(items(5), options().maxConcurrency(1).checkpointInterval(Duration.ofSeconds(10)).build(), item -> {
            clock.advance(Duration.ofSeconds(6));
            return item;
        }, listener, token);

        assertEquals(List.of(2, 4), listener.cursors());
    }

    @Test
    void checkpointCursorNeverMovesBackwards() {
        RecordingListener listener = new RecordingListener();

        processor.run(items(200), options().checkpointEveryItems(5).build(), item -> {
            if (item % 37 == 0 && item > 0) {
                throw new IllegalStateException("boom");
            }
            Thread.sleep(item % 3);
            return item;
        }, listener, token);

        List<Integer> cursors = listener.cursors();
        assertFalse(cursors.isEmpty());
        for (int i = 1; i < cursors.size(); i++) {
            assertTrue(cursors.get(i) >= cursors.get(i - 1), "cursors " + cursors);
        }
        assertTrue(cursors.get(cursors.size() - 1) <= 37);
    }

    @Test
    void failedCheckpointIsRetriedAtNextChunk() {
        List<Integer> attempts = new CopyOnWriteArrayList<>();
        BatchListener<Integer> listener = new BatchListener<>() {
            @Override
            public void onCheckpoint(BatchProgress<Integer> progress) {
                attempts.add(progress.getCursor());
                if (attempts.size() == 1) {
                    throw new IllegalStateException("store down");
                }
            }
        };

        BatchResult<Integer> result = processor.run(items(5), options().maxConcurrency(1).checkpointEveryItems(3).build(),
                item -> item, listener, token);

        assertTrue(result.isComplete());
        assertEquals(List.of(3, 4), attempts);
    }

    @Test
    void stuckItemsAreInterruptedAfterDrainTimeout() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        Thread canceller = new Thread(() -> {
            try {
                started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        long begin = System.nanoTime();
        BatchResult<Integer> result = processor.run(items(3), options().maxConcurrency(1).drainTimeout(Duration.ofMillis(200)).build(),
                item -> {
                    started.countDown();
                    Thread.sleep(60_000);
                    return item;
                }, new RecordingListener(), token);
        canceller.join();

        assertTrue(Duration.ofNanos(System.nanoTime() - begin).compareTo(Duration.ofSeconds(10)) < 0);
        assertTrue(result.isCancelled());
        assertTrue(result.getFailures().isEmpty(), "an interrupted item is not a failure");
        assertEquals(3, result.getSkipped());
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class,
                () -> processor.run(items(1), options().chunkSize(0).build(), item -> item, new RecordingListener(), token));
    }
}
