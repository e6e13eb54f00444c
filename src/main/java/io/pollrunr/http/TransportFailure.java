package io.pollrunr.http;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Optional;

/**
 * The failure kinds that are worth retrying. Anything that does not classify
 * as one of these is either a protocol error or a bug, and is not retried.
 */
public enum TransportFailure {
    /** The connection could not be established. */
    CONNECTION,
    /** The connection dropped or the response stream broke mid-transfer. */
    PAYLOAD,
    /** No response within the per-attempt timeout. */
    TIMEOUT;

    /**
     * Classifies a failure thrown while sending a request.
     *
     * @return the retryable kind, or empty if the failure must not be retried
     */
    public static Optional<TransportFailure> classify(Throwable error) {
        if (error instanceof JsonProcessingException) {
            return Optional.empty();
        }
        if (error instanceof HttpConnectTimeoutException
                || error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof UnresolvedAddressException) {
            return Optional.of(CONNECTION);
        }
        if (error instanceof HttpTimeoutException) {
            return Optional.of(TIMEOUT);
        }
        if (error instanceof IOException) {
            return Optional.of(PAYLOAD);
        }
        return Optional.empty();
    }
}
