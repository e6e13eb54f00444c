package io.pollrunr.watch;

import java.util.Objects;

/**
 * The interactive destination of a manually requested poll. Results and errors go back here.
 */
public record Requester(String targetId) {

    public Requester {
        Objects.requireNonNull(targetId, "targetId");
    }
}
