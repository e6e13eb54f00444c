package io.pollrunr;

/**
 * Base type for failures raised by the poller runtime.
 */
public class PollRunrException extends RuntimeException {

    public PollRunrException(String message) {
        super(message);
    }

    public PollRunrException(String message, Throwable cause) {
        super(message, cause);
    }
}
