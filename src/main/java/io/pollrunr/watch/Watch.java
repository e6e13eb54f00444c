package io.pollrunr.watch;

import io.pollrunr.channel.RenderableItem;

import java.util.List;

/**
 * A recurring check against the API. Registered with the scheduler at startup
 * and also runnable on demand.
 */
public interface Watch {

    /** Unique name; also the scheduler task name and the configuration key. */
    String name();

    /** Cron expression used when none is configured. */
    String defaultCron();

    /** Whether the watch runs when configuration says nothing. */
    default boolean enabledByDefault() {
        return true;
    }

    /**
     * Runs the check once.
     *
     * @param requester interactive destination, or null when fired by the scheduler
     * @return the items delivered
     */
    List<RenderableItem> poll(Requester requester);
}
