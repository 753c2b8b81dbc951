package com.dmarket.arb.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket holding {@code capacity} tokens. A token taken at {@code t} is credited back at
 * {@code t + period}, so no window of length {@code period} ever sees more than {@code capacity}
 * grants, bursts included.
 *
 * <p>Waiters queue on a fair lock and are served in arrival order. The caller holding the lock
 * sleeps until the oldest token comes back; everyone behind it waits on the lock.
 */
@Slf4j
public class RateLimiter {

    private final int capacity;
    private final Duration period;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Deque<Instant> granted = new ArrayDeque<>();

    public RateLimiter(int capacity, Duration period, Clock clock, Sleeper sleeper) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        this.capacity = capacity;
        this.period = period;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a token is available and takes it.
     *
     * @throws InterruptedException if the caller is interrupted while queued or waiting
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                Instant now = clock.instant();
                evictExpired(now);
                if (granted.size() < capacity) {
                    granted.addLast(now);
                    return;
                }
                Duration wait = Duration.between(now, granted.peekFirst().plus(period));
                log.debug("[API] Rate limit reached ({} per {}), waiting {} ms", capacity, period, wait.toMillis());
                sleeper.sleep(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    public int availableTokens() {
        lock.lock();
        try {
            evictExpired(clock.instant());
            return capacity - granted.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Instant now) {
        Instant horizon = now.minus(period);
        while (!granted.isEmpty() && !granted.peekFirst().isAfter(horizon)) {
            granted.pollFirst();
        }
    }
}
