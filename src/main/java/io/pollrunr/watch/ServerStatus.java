package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server state as reported by the status endpoint. Two statuses are the same observation
 * when both the change time and the status match.
 *
 * @param time   epoch seconds of the last state change
 * @param status 1 when open
 */
public record ServerStatus(long time, int status) {

    static final int OPEN = 1;

    static ServerStatus from(JsonNode data) {
        JsonNode time = data.path("time");
        JsonNode status = data.path("status");
        if (!time.canConvertToLong() || !status.canConvertToInt()) {
            throw new IllegalArgumentException("Server status response lacks time/status: " + data);
        }
        return new ServerStatus(time.asLong(), status.asInt());
    }

    public boolean isOpen() {
        return status == OPEN;
    }
}
