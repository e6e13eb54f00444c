package io.pollrunr.channel;

/**
 * One piece of a notification handed to a {@link DeliveryChannel}.
 * How an item is rendered on the wire is up to the channel.
 */
public interface RenderableItem {

    /**
     * Plain-text rendering, used for logs and text-only channels.
     */
    String asText();
}
