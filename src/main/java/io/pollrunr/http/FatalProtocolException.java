package io.pollrunr.http;

import io.pollrunr.PollRunrException;

import java.net.URI;

/**
 * The server answered with a status outside 2xx. Never retried.
 */
public class FatalProtocolException extends PollRunrException {

    private final String method;
    private final URI uri;
    private final int status;
    private final String body;

    public FatalProtocolException(String method, URI uri, int status, String body) {
        super("%s %s returned HTTP %d: %s".formatted(method, uri, status, abbreviate(body)));
        this.method = method;
        this.uri = uri;
        this.status = status;
        this.body = body;
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
