package io.pollrunr.cron;

/** What happens when a task fires while an earlier execution of it is still running. */
public enum OverlapPolicy {
    /** Dispatch anyway; executions of the same task may run concurrently. */
    ALLOW,
    /** Skip this fire and wait for the next one. */
    SKIP_IF_RUNNING
}
