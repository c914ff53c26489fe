/**
 * Exponential backoff with additive jitter for catalog API retries
 *
 * @author William Callahan
 *
 * Features:
 * - Delay for retry n (0-based) is base * 2^n plus a jitter drawn from [0, jitterFactor * base * 2^n]
 * - Every delay is capped at the configured maximum
 * - Random source is injectable so tests can pin the jitter
 */
package com.williamcallahan.movie_discovery_engine.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class RetryBackoffPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public RetryBackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(maxRetries, baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random supplier of values in [0, 1) used to scale the jitter
     */
    public RetryBackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.random = random;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * @param retry 0-based index of the retry about to be scheduled
     * @return delay before that retry, never above the maximum
     */
    public Duration delayFor(long retry) {
        double exponentialMs = baseDelay.toMillis() * Math.pow(2, Math.min(retry, 30));
        double jitterMs = random.getAsDouble() * jitterFactor * exponentialMs;
        long delayMs = (long) Math.min(maxDelay.toMillis(), exponentialMs + jitterMs);
        return Duration.ofMillis(Math.max(0, delayMs));
    }
}
