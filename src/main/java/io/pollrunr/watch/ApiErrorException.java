package io.pollrunr.watch;

import io.pollrunr.PollRunrException;

/**
 * The API answered 2xx but its envelope reports a failure code.
 */
public class ApiErrorException extends PollRunrException {

    private final String code;
    private final String apiMessage;

    public ApiErrorException(String code, String apiMessage) {
        super("API returned code %s: %s".formatted(code, apiMessage));
        this.code = code;
        this.apiMessage = apiMessage;
    }

    public String getCode() {
        return code;
    }

    /**
     * The API's own message ({@code msg}), or null if it sent none.
     */
    public String getApiMessage() {
        return apiMessage;
    }
}
