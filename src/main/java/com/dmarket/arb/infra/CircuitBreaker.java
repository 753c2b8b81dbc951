package com.dmarket.arb.infra;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Closed / Open / Half-Open gate for one upstream.
 *
 * <p>Failures are counted in a fixed window that starts at the first failure. Reaching
 * {@code failureThreshold} inside the window opens the circuit for {@code resetTimeout}; after that
 * a single trial call is let through. All transitions happen under the instance monitor.
 *
 * <p>Every admitted call holds a {@link Permission} stamped with the state generation it was
 * granted in. Outcomes reported with a permission from an earlier generation are ignored, so a
 * slow call admitted before the circuit opened cannot close it while the trial call is running.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration resetTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private int failureCount;
    private Instant windowStart;
    private Instant lastFailureAt;
    private Instant openUntil;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration failureWindow, Duration resetTimeout, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.failureWindow = failureWindow;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    /**
     * Runs {@code call} if the gate allows it. A thrown exception, or a result matching
     * {@code isFailure}, counts as a failure; anything else counts as a success.
     *
     * @throws CircuitOpenException if the call was rejected without being attempted
     */
    public <T> T execute(Callable<T> call, Predicate<? super T> isFailure) throws Exception {
        Permission permission = tryAcquirePermission()
                .orElseThrow(() -> new CircuitOpenException(name, snapshot().getOpenUntil()));
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            recordFailure(permission);
            throw e;
        }
        if (isFailure.test(result)) {
            recordFailure(permission);
        } else {
            recordSuccess(permission);
        }
        return result;
    }

    /**
     * Gate check. In Half-Open only the first caller gets through until its outcome is recorded.
     */
    public synchronized Optional<Permission> tryAcquirePermission() {
        if (state == CircuitState.OPEN) {
            if (clock.instant().isBefore(openUntil)) {
                return Optional.empty();
            }
            transitionTo(CircuitState.HALF_OPEN);
            trialInFlight = false;
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                return Optional.empty();
            }
            trialInFlight = true;
            return Optional.of(new Permission(generation, true));
        }
        return Optional.of(new Permission(generation, false));
    }

    public synchronized void recordSuccess(Permission permission) {
        if (isStale(permission)) {
            return;
        }
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.CLOSED);
            resetCounters();
        }
    }

    public synchronized void recordFailure(Permission permission) {
        if (isStale(permission)) {
            log.debug("[BREAKER] '{}' ignoring failure of a call admitted before the last transition", name);
            return;
        }
        Instant now = clock.instant();
        lastFailureAt = now;
        if (state == CircuitState.HALF_OPEN) {
            open(now);
            return;
        }
        if (windowStart == null || !now.isBefore(windowStart.plus(failureWindow))) {
            windowStart = now;
            failureCount = 0;
        }
        failureCount++;
        if (failureCount >= failureThreshold) {
            open(now);
        }
    }

    /**
     * Gives back a permission without an outcome, e.g. when the upstream answered 429. In Half-Open
     * this lets the next caller make the trial call.
     */
    public synchronized void releasePermission(Permission permission) {
        if (!isStale(permission) && state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, failureCount, lastFailureAt, openUntil);
    }

    public String getName() {
        return name;
    }

    private boolean isStale(Permission permission) {
        return permission.getGeneration() != generation || (state == CircuitState.HALF_OPEN && !permission.isTrial());
    }

    private void open(Instant now) {
        openUntil = now.plus(resetTimeout);
        trialInFlight = false;
        transitionTo(CircuitState.OPEN);
        log.warn("[BREAKER] '{}' open until {} after {} failure(s)", name, openUntil, failureCount);
    }

    private void resetCounters() {
        failureCount = 0;
        windowStart = null;
        openUntil = null;
        trialInFlight = false;
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.info("[BREAKER] '{}' {} -> {}", name, state, next);
            state = next;
            generation++;
        }
    }

    /** Ticket for one admitted call; hand it back with the call's outcome. */
    @Value
    public static class Permission {
        long generation;
        boolean trial;
    }

    @Value
    public static class Snapshot {
        CircuitState state;
        int failureCount;
        Instant lastFailureAt;
        Instant openUntil;
    }
}
