package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.RenderableItem;

import java.util.List;

/**
 * Turns the {@code data} part of a successful API response into notification items.
 * An empty list means there is nothing to send.
 */
@FunctionalInterface
public interface DataHandler {

    List<RenderableItem> handle(JsonNode data) throws Exception;
}
