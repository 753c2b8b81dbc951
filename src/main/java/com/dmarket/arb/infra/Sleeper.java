package com.dmarket.arb.infra;

import java.time.Duration;

/**
 * Blocking pause, separated out so backoff and rate waiting can be driven by a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
