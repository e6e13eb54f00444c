package io.pollrunr.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The polled API: base URL plus the parameters sent with every request.
 * Fixed parameters can be replaced at runtime (for example a renewed ticket); changes are not persisted.
 */
public class ApiEndpoint {

    private static final Logger log = LoggerFactory.getLogger(ApiEndpoint.class);

    private final String host;
    private final Map<String, String> fixedParams = new ConcurrentHashMap<>();

    public ApiEndpoint(String host, Map<String, String> fixedParams) {
        this.host = Objects.requireNonNull(host, "host");
        if (fixedParams != null) {
            fixedParams.forEach((key, value) -> {
                if (value != null) {
                    this.fixedParams.put(key, value);
                }
            });
        }
    }

    /**
     * Returns the full URL for a path.
     */
    public String url(String path) {
        if (host.endsWith("/") && path.startsWith("/")) {
            return host + path.substring(1);
        }
        return host + path;
    }

    /**
     * Merges the fixed parameters with per-request ones. Per-request values win.
     */
    public Map<String, String> params(Map<String, ?> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(fixedParams);
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, String.valueOf(value));
                }
            });
        }
        return merged;
    }

    /**
     * Returns a fixed parameter, or null if not set.
     */
    public String param(String key) {
        return fixedParams.get(key);
    }

    /**
     * Replaces a fixed parameter for all later requests.
     */
    public void updateParam(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        fixedParams.put(key, value);
        log.info("Updated request parameter '{}'", key);
    }

    public String getHost() {
        return host;
    }
}
