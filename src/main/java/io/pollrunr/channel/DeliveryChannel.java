package io.pollrunr.channel;

import java.util.List;

/**
 * Delivers notifications to a target (a group, a chat, a user).
 * Implementations own the transport; the poller only hands over items.
 */
public interface DeliveryChannel {

    /**
     * Sends items to one target.
     *
     * @param targetId the destination identifier
     * @param items    the items to deliver, never empty
     */
    void send(String targetId, List<? extends RenderableItem> items);

    /**
     * Returns the display name of this channel.
     */
    String getName();
}
