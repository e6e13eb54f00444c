package io.pollrunr.cron;

import java.util.List;

/**
 * The unit of work a scheduled task runs on every fire.
 * Receives the arguments bound when the task was registered.
 * Must tolerate being invoked again before a previous invocation has finished.
 */
@FunctionalInterface
public interface TaskJob {

    void run(List<Object> boundArgs) throws Exception;
}
