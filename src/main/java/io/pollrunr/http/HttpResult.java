package io.pollrunr.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of one logical request.
 *
 * @param outcome  SUCCESS when a 2xx response was decoded, EXHAUSTED when every attempt hit a retryable failure
 * @param body     decoded JSON body, or null when exhausted
 * @param attempts number of attempts made
 * @param failures retryable failures seen, in order
 */
public record HttpResult(Outcome outcome, JsonNode body, int attempts, List<TransportFailure> failures) {

    public enum Outcome { SUCCESS, EXHAUSTED }

    public HttpResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    static HttpResult success(JsonNode body, int attempts, List<TransportFailure> failures) {
        return new HttpResult(Outcome.SUCCESS, body, attempts, failures);
    }

    static HttpResult exhausted(int attempts, List<TransportFailure> failures) {
        return new HttpResult(Outcome.EXHAUSTED, null, attempts, failures);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isExhausted() {
        return outcome == Outcome.EXHAUSTED;
    }
}
