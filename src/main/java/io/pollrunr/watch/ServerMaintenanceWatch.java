package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.RenderableItem;
import io.pollrunr.detect.ChangeDetector;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Early-morning status check for maintenance days. Stores the current status without
 * notifying, which re-arms {@link ServerOpenWatch}.
 */
@Component
public class ServerMaintenanceWatch implements Watch {

    static final String NAME = "server-maintenance";

    private final ResultHandler resultHandler;
    private final ChangeDetector changeDetector;

    public ServerMaintenanceWatch(ResultHandler resultHandler, ChangeDetector changeDetector) {
        this.resultHandler = resultHandler;
        this.changeDetector = changeDetector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultCron() {
        return "0 5 * * *";
    }

    @Override
    public boolean enabledByDefault() {
        return false;
    }

    @Override
    public List<RenderableItem> poll(Requester requester) {
        return resultHandler.handle(ServerOpenWatch.PATH, Map.of(), this::record, requester);
    }

    List<RenderableItem> record(JsonNode data) {
        changeDetector.record(ServerOpenWatch.STREAM_KEY, ServerStatus.from(data));
        return List.of();
    }
}
