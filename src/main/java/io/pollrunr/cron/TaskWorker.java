package io.pollrunr.cron;

import io.pollrunr.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The control loop for one {@link ScheduledTask}: compute the next fire time, sleep until it,
 * hand the fire to the dispatcher, repeat.
 *
 * <p>The loop never waits for the job itself. It only ends when cancelled; internal errors are
 * logged and retried after {@link #ERROR_BACKOFF}.</p>
 */
final class TaskWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);
    static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);

    enum State { RUNNING, CANCEL_REQUESTED, TERMINATED }

    /** Receives each due fire. */
    @FunctionalInterface
    interface FireHandler {
        void onFire(ScheduledTask task, Instant fireTime);
    }

    private final ScheduledTask task;
    private final Clock clock;
    private final Sleeper sleeper;
    private final FireHandler fireHandler;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile State state = State.RUNNING;
    private volatile Instant cursor;
    private volatile Future<?> handle;

    TaskWorker(ScheduledTask task, Clock clock, Sleeper sleeper, FireHandler fireHandler) {
        this.task = task;
        this.clock = clock;
        this.sleeper = sleeper;
        this.fireHandler = fireHandler;
    }

    void start(ExecutorService executor) {
        this.handle = executor.submit(this);
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        cursor = clock.instant();
        log.debug("Worker for task '{}' started at {}", task.name(), cursor);
        try {
            loop();
        } finally {
            state = State.TERMINATED;
            terminated.countDown();
            log.debug("Worker for task '{}' terminated", task.name());
        }
    }

    private void loop() {
        while (!cancelled.get()) {
            try {
                Instant next = task.schedule().nextAfter(cursor);
                cursor = next;

                Duration wait = Duration.between(clock.instant(), next);
                if (!wait.isNegative() && !wait.isZero()) {
                    sleeper.sleep(wait);
                }
                if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                    return;
                }
                fireHandler.onFire(task, next);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Scheduling loop error for task '{}', retrying in {}", task.name(), ERROR_BACKOFF, e);
                try {
                    sleeper.sleep(ERROR_BACKOFF);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * Requests cancellation. Interrupts a pending sleep. Safe to call more than once.
     */
    void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        if (started.compareAndSet(false, true)) {
            // never ran; nothing to interrupt
            state = State.TERMINATED;
            terminated.countDown();
            if (handle != null) {
                handle.cancel(false);
            }
            return;
        }
        if (state != State.TERMINATED) {
            state = State.CANCEL_REQUESTED;
        }
        if (handle != null) {
            handle.cancel(true);
        }
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    ScheduledTask task() {
        return task;
    }

    State state() {
        return terminated.getCount() == 0 ? State.TERMINATED : state;
    }

    Instant cursor() {
        return cursor;
    }
}
