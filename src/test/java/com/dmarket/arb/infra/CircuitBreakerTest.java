package com.dmarket.arb.infra;

import com.dmarket.arb.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        breaker = new CircuitBreaker("test", 5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock);
    }

    @Test
    void fifthFailureInsideWindowOpensCircuit() {
        for (int i = 0; i < 4; i++) {
            failOnce();
            clock.advance(Duration.ofSeconds(10));
        }
        assertEquals(CircuitState.CLOSED, breaker.getState());

        failOnce();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertTrue(breaker.tryAcquirePermission().isEmpty());
    }

    @Test
    void failuresSpreadOverSeveralWindowsDoNotOpen() {
        for (int i = 0; i < 10; i++) {
            failOnce();
            clock.advance(Duration.ofSeconds(20));
        }

        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void openCircuitFailsFastWithoutCallingUpstream() {
        tripOpen();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(CircuitOpenException.class, () -> breaker.execute(calls::incrementAndGet, r -> false));
        assertEquals(0, calls.get());
    }

    @Test
    void halfOpenLetsExactlyOneTrialCallThrough() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquirePermission().orElseThrow().isTrial());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.tryAcquirePermission().isEmpty());
    }

    @Test
    void successfulTrialCallClosesCircuit() throws Exception {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        String result = breaker.execute(() -> "ok", r -> false);

        assertEquals("ok", result);
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.snapshot().getFailureCount());
        assertFalse(breaker.tryAcquirePermission().orElseThrow().isTrial());
    }

    @Test
    void failedTrialCallReopensWithFreshTimer() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));

        assertThrows(IOException.class, () -> breaker.execute(() -> {
            throw new IOException("still down");
        }, r -> false));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant().plusSeconds(60), breaker.snapshot().getOpenUntil());
        clock.advance(Duration.ofSeconds(59));
        assertTrue(breaker.tryAcquirePermission().isEmpty());
    }

    @Test
    void predicateDecidesWhatCountsAsFailure() throws Exception {
        for (int i = 0; i < 5; i++) {
            breaker.execute(() -> 503, status -> status >= 500);
        }
        assertEquals(CircuitState.OPEN, breaker.getState());

        CircuitBreaker other = new CircuitBreaker("other", 5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock);
        for (int i = 0; i < 10; i++) {
            other.execute(() -> 404, status -> status >= 500);
        }
        assertEquals(CircuitState.CLOSED, other.getState());
    }

    @Test
    void releasedTrialLetsNextCallerTry() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        CircuitBreaker.Permission trial = breaker.tryAcquirePermission().orElseThrow();

        breaker.releasePermission(trial);

        assertTrue(breaker.tryAcquirePermission().isPresent());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    @Test
    void lateSuccessFromBeforeOpeningDoesNotCloseCircuit() {
        CircuitBreaker.Permission slow = breaker.tryAcquirePermission().orElseThrow();
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        CircuitBreaker.Permission trial = breaker.tryAcquirePermission().orElseThrow();

        breaker.recordSuccess(slow);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.tryAcquirePermission().isEmpty(), "trial call still owns the half-open slot");

        breaker.recordSuccess(trial);

        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void lateFailureFromBeforeOpeningDoesNotReopenCircuit() {
        CircuitBreaker.Permission slow = breaker.tryAcquirePermission().orElseThrow();
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        breaker.tryAcquirePermission().orElseThrow();

        breaker.recordFailure(slow);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    private void failOnce() {
        breaker.recordFailure(breaker.tryAcquirePermission().orElseThrow());
    }

    private void tripOpen() {
        for (int i = 0; i < 5; i++) {
            failOnce();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }
}
