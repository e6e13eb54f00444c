package io.pollrunr.config;

import io.pollrunr.http.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the poller.
 *
 * <p>Binds to {@code pollrunr} in application.yml:</p>
 * <pre>
 * pollrunr:
 *   http:
 *     max-retries: 3
 *     base-delay: 500ms
 *     timeout: 10s
 *   api:
 *     host: https://api.example.com
 *     params:
 *       server: ${POLLRUNR_SERVER:}
 *       token: ${POLLRUNR_TOKEN:}
 *   subscribers:
 *     - group-1
 *   watches:
 *     skill-change:
 *       cron: "0 12 * * *"
 *     server-open:
 *       enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "pollrunr")
public record PollRunrProperties(
        RetryPolicy http,
        Api api,
        Scheduler scheduler,
        List<String> subscribers,
        Map<String, WatchConfig> watches
) {

    public PollRunrProperties {
        if (http == null) {
            http = RetryPolicy.defaults();
        }
        if (api == null) {
            api = new Api(null, null, null, null);
        }
        if (scheduler == null) {
            scheduler = new Scheduler(null);
        }
        if (subscribers == null) {
            subscribers = List.of();
        }
        if (watches == null) {
            watches = Map.of();
        }
    }

    /**
     * Returns the settings of a watch, or empty settings when it is not configured.
     */
    public WatchConfig watch(String name) {
        return watches.getOrDefault(name, new WatchConfig(null, null));
    }

    /**
     * The polled API.
     *
     * @param host         base URL that request paths are appended to
     * @param params       parameters sent with every request
     * @param successCode  envelope {@code code} that marks a successful response (default 200)
     * @param errorMessage reply sent to an interactive requester when no better message is available
     */
    public record Api(String host, Map<String, String> params, Integer successCode, String errorMessage) {
        public Api {
            if (host == null) {
                host = "";
            }
            if (params == null) {
                params = Map.of();
            }
            if (successCode == null) {
                successCode = 200;
            }
            if (errorMessage == null || errorMessage.isBlank()) {
                errorMessage = "Unknown error";
            }
        }
    }

    /**
     * @param zone zone that cron expressions are evaluated in; system default when blank
     */
    public record Scheduler(String zone) {
        public ZoneId zoneId() {
            return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        }
    }

    /**
     * Per-watch overrides. Null fields fall back to the watch's own defaults.
     */
    public record WatchConfig(Boolean enabled, String cron) {}
}
