package io.pollrunr.http;

import java.time.Duration;

/**
 * Retry and connection settings for {@link ResilientHttpClient}.
 * Binds to {@code pollrunr.http} in application.yml.
 *
 * @param maxRetries            attempts per logical request, including the first
 * @param baseDelay             backoff before the second attempt; doubles for each later one
 * @param maxJitter             upper bound (exclusive) of the random delay added to each backoff
 * @param timeout               connect timeout and per-attempt response timeout
 * @param maxConnectionsPerHost in-flight requests allowed per host
 */
public record RetryPolicy(
        Integer maxRetries,
        Duration baseDelay,
        Duration maxJitter,
        Duration timeout,
        Integer maxConnectionsPerHost
) {
    public RetryPolicy {
        if (maxRetries == null) {
            maxRetries = 3;
        }
        if (baseDelay == null) {
            baseDelay = Duration.ofMillis(500);
        }
        if (maxJitter == null) {
            maxJitter = Duration.ofMillis(100);
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(10);
        }
        if (maxConnectionsPerHost == null) {
            maxConnectionsPerHost = 100;
        }
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must not be negative");
        if (maxJitter.isNegative()) throw new IllegalArgumentException("maxJitter must not be negative");
        if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
        if (maxConnectionsPerHost < 1) throw new IllegalArgumentException("maxConnectionsPerHost must be >= 1");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(null, null, null, null, null);
    }

    /**
     * Delay to wait after the failed attempt {@code attemptIndex} (0-based):
     * {@code baseDelay * 2^attemptIndex + maxJitter * jitterFraction}.
     *
     * @param jitterFraction a value in [0, 1)
     */
    public Duration backoffDelay(int attemptIndex, double jitterFraction) {
        long jitterNanos = (long) (maxJitter.toNanos() * jitterFraction);
        return baseDelay.multipliedBy(1L << attemptIndex).plusNanos(jitterNanos);
    }
}
