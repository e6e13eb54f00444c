package io.pollrunr.watch;

import io.pollrunr.channel.RenderableItem;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An on-demand lookup against the API. Unlike a {@link Watch} it is never scheduled and
 * does no change detection: every successful response is rendered and sent to the requester.
 */
public interface Query {

    String name();

    /** Argument names that {@link #run} needs. */
    default Set<String> requiredArgs() {
        return Set.of();
    }

    /**
     * Fetches and replies to the requester.
     *
     * @return the items delivered
     * @throws IllegalArgumentException if a required argument is missing or blank
     */
    List<RenderableItem> run(Requester requester, Map<String, String> args);
}
