package com.dmarket.arb.infra;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(maxDelay, baseDelay * multiplier^(attempt-1))} plus up to
 * {@code jitterRatio} of that delay at random.
 */
@Value
@Builder
public class RetryPolicy {
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(10);
    @Builder.Default
    double jitterRatio = 0.2;
    @Builder.Default
    Duration maxRetryAfter = Duration.ofSeconds(60);

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @param random  uniform value in [0, 1)
     */
    public Duration backoff(int attempt, double random) {
        double exponential = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(exponential, maxDelay.toMillis());
        long jitter = (long) (capped * jitterRatio * random);
        return Duration.ofMillis(capped + jitter);
    }

    /** Server-provided hint, capped so that a hostile header cannot stall a scan indefinitely. */
    public Duration retryAfter(Duration hint) {
        return hint.compareTo(maxRetryAfter) > 0 ? maxRetryAfter : hint;
    }
}
