package io.pollrunr.support;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a duration.
 * Abstracted so scheduling and retry timing can be driven by a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps using {@link TimeUnit#sleep}. Zero and negative durations return immediately.
     */
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    /**
     * Sleeps for the given duration.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;
}
