package io.pollrunr.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Default channel used when the host application provides none: writes each delivery to the log.
 */
public class LoggingDeliveryChannel implements DeliveryChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    @Override
    public void send(String targetId, List<? extends RenderableItem> items) {
        String text = items.stream().map(RenderableItem::asText).collect(Collectors.joining("\n"));
        log.info("Delivery to '{}': {}", targetId, text);
    }

    @Override
    public String getName() {
        return "log";
    }
}
