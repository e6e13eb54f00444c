package io.pollrunr.cron;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for one dispatched execution of a task.
 *
 * @param taskName the task that fired
 * @param fireTime the scheduled fire time, or the trigger time for manual runs
 * @param manual   whether this run was triggered outside the schedule
 * @param future   completes when the job returns; never completes exceptionally
 */
public record JobExecution(String taskName, Instant fireTime, boolean manual, CompletableFuture<Void> future) {

    public boolean isDone() {
        return future.isDone();
    }
}
