package io.pollrunr.cron;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a registered task.
 *
 * @param name              task name
 * @param cron              the cron expression
 * @param overlapPolicy     overlap handling
 * @param boundArgCount     number of bound arguments
 * @param nextFireTime      the worker's cursor, or null when the worker has terminated
 * @param fireCount         scheduled executions dispatched so far
 * @param skippedCount      fires skipped because an earlier run was still active
 * @param runningExecutions executions that have not finished yet
 * @param workerState       RUNNING or TERMINATED
 */
public record TaskView(
        String name,
        String cron,
        OverlapPolicy overlapPolicy,
        int boundArgCount,
        Instant nextFireTime,
        long fireCount,
        long skippedCount,
        int runningExecutions,
        String workerState
) {
    static TaskView of(ScheduledTask task, TaskWorker worker, long fireCount, long skippedCount,
                       List<JobExecution> running) {
        boolean terminated = worker.state() == TaskWorker.State.TERMINATED;
        return new TaskView(
                task.name(),
                task.schedule().expression(),
                task.overlapPolicy(),
                task.boundArgs().size(),
                terminated ? null : worker.cursor(),
                fireCount,
                skippedCount,
                running.size(),
                worker.state().name()
        );
    }
}
