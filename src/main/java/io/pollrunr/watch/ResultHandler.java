package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.DeliveryChannel;
import io.pollrunr.channel.PlainText;
import io.pollrunr.channel.RenderableItem;
import io.pollrunr.config.PollRunrProperties;
import io.pollrunr.http.HttpResult;
import io.pollrunr.http.ResilientHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fetches an API path, unwraps the {@code {code, msg, data}} envelope, lets a {@link DataHandler}
 * decide what to send, and routes the result.
 *
 * <p>Routing: with a {@link Requester} (interactive) everything, errors included, goes back to
 * the requester. Without one (scheduled) items go to every configured subscriber and failures are
 * only logged.</p>
 */
@Component
public class ResultHandler {

    private static final Logger log = LoggerFactory.getLogger(ResultHandler.class);

    private final ResilientHttpClient httpClient;
    private final ApiEndpoint endpoint;
    private final DeliveryChannel channel;
    private final List<String> subscribers;
    private final int successCode;
    private final String genericError;

    public ResultHandler(ResilientHttpClient httpClient, ApiEndpoint endpoint, DeliveryChannel channel,
                         PollRunrProperties properties) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.channel = channel;
        this.subscribers = List.copyOf(properties.subscribers());
        this.successCode = properties.api().successCode();
        this.genericError = properties.api().errorMessage();
    }

    /**
     * Runs one fetch-decide-deliver cycle. Never throws.
     *
     * @param path      API path appended to the host
     * @param params    per-request parameters merged over the fixed ones, may be null
     * @param handler   maps {@code data} to items
     * @param requester interactive destination, or null for scheduled runs
     * @return the items delivered, empty when nothing was sent
     */
    public List<RenderableItem> handle(String path, Map<String, ?> params, DataHandler handler, Requester requester) {
        String url = endpoint.url(path);
        JsonNode data;
        try {
            HttpResult result = httpClient.post(url, endpoint.params(params));
            if (result.isExhausted()) {
                log.warn("API request to {} gave up after {} attempts", path, result.attempts());
                replyError(requester, null);
                return List.of();
            }
            data = unwrap(result.body());
        } catch (ApiErrorException e) {
            log.warn("API request to {} returned an error: {}", path, e.getMessage());
            replyError(requester, e.getApiMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("API request to {} was interrupted", path);
            return List.of();
        } catch (Exception e) {
            log.warn("API request to {} failed: {}", path, e.toString());
            replyError(requester, null);
            return List.of();
        }

        try {
            List<RenderableItem> items = handler.handle(data);
            if (items == null || items.isEmpty()) {
                log.debug("Nothing to deliver for {}", path);
                return List.of();
            }
            List<String> targets = requester != null ? List.of(requester.targetId()) : subscribers;
            for (String target : targets) {
                channel.send(target, items);
            }
            log.info("Delivered {} item(s) from {} to {} target(s)", items.size(), path, targets.size());
            return List.copyOf(items);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Failed to process result of {}", path, e);
            replyError(requester, null);
            return List.of();
        }
    }

    /**
     * Returns {@code data} when the envelope reports success.
     *
     * @throws ApiErrorException when {@code code} is missing or not the success code
     */
    JsonNode unwrap(JsonNode body) {
        JsonNode code = body.path("code");
        if (!code.canConvertToInt() || code.asInt() != successCode) {
            String message = body.path("msg").isTextual() ? body.path("msg").asText() : null;
            throw new ApiErrorException(code.isMissingNode() ? "missing" : code.asText(), message);
        }
        return body.path("data");
    }

    private void replyError(Requester requester, String message) {
        if (requester == null) {
            return;
        }
        String text = message != null && !message.isBlank() ? message : genericError;
        try {
            channel.send(requester.targetId(), List.of(new PlainText(text)));
        } catch (RuntimeException e) {
            log.error("Failed to deliver error reply to '{}'", requester.targetId(), e);
        }
    }
}
