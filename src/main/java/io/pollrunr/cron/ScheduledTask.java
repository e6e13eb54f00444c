package io.pollrunr.cron;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A registered recurring unit of work.
 *
 * @param name          unique task name
 * @param job           the work to run on every fire
 * @param schedule      when to fire
 * @param boundArgs     arguments captured at registration, passed to every invocation
 * @param overlapPolicy how to treat a fire that arrives while a previous execution still runs
 */
public record ScheduledTask(
        String name,
        TaskJob job,
        CronSchedule schedule,
        List<Object> boundArgs,
        OverlapPolicy overlapPolicy
) {
    public ScheduledTask {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(schedule, "schedule");
        if (boundArgs == null) {
            boundArgs = List.of();
        }
        if (overlapPolicy == null) {
            overlapPolicy = OverlapPolicy.ALLOW;
        }
    }

    /**
     * Creates a task binding the given arguments. Null arguments are kept as-is.
     */
    public static ScheduledTask of(String name, TaskJob job, CronSchedule schedule,
                                   OverlapPolicy overlapPolicy, Object... args) {
        List<Object> bound = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args.clone()));
        return new ScheduledTask(name, job, schedule, bound, overlapPolicy);
    }

    /**
     * Runs the job once with the bound arguments.
     */
    public void invoke() throws Exception {
        job.run(boundArgs);
    }
}
