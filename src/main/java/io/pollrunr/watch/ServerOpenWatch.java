package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.PlainText;
import io.pollrunr.channel.RenderableItem;
import io.pollrunr.config.PollRunrProperties;
import io.pollrunr.detect.ChangeDetector;
import io.pollrunr.detect.Observation;
import io.pollrunr.detect.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Polls the server status until the server is open again and announces the opening.
 * Scheduled polls stop doing work once an open status is stored;
 * {@link ServerMaintenanceWatch} re-arms it by recording the closed status.
 */
@Component
public class ServerOpenWatch implements Watch {

    private static final Logger log = LoggerFactory.getLogger(ServerOpenWatch.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    static final String NAME = "server-open";
    static final String PATH = "/data/server/check";
    static final StreamKey<ServerStatus> STREAM_KEY = StreamKey.of("server-status", ServerStatus.class);

    private final ResultHandler resultHandler;
    private final ChangeDetector changeDetector;
    private final ApiEndpoint endpoint;
    private final ZoneId zone;

    @Autowired
    public ServerOpenWatch(ResultHandler resultHandler, ChangeDetector changeDetector, ApiEndpoint endpoint,
                           PollRunrProperties properties) {
        this(resultHandler, changeDetector, endpoint, properties.scheduler().zoneId());
    }

    ServerOpenWatch(ResultHandler resultHandler, ChangeDetector changeDetector, ApiEndpoint endpoint, ZoneId zone) {
        this.resultHandler = resultHandler;
        this.changeDetector = changeDetector;
        this.endpoint = endpoint;
        this.zone = zone;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultCron() {
        return "*/20 8-18 * * *";
    }

    @Override
    public boolean enabledByDefault() {
        return false;
    }

    @Override
    public List<RenderableItem> poll(Requester requester) {
        Optional<ServerStatus> last = changeDetector.current(STREAM_KEY);
        if (requester == null && last.isPresent() && last.get().isOpen()) {
            log.debug("Server already open, skipping status check");
            return List.of();
        }
        return resultHandler.handle(PATH, Map.of(), this::toItems, requester);
    }

    List<RenderableItem> toItems(JsonNode data) {
        ServerStatus status = ServerStatus.from(data);
        Observation<ServerStatus> observation = changeDetector.observe(STREAM_KEY, status);
        if (!observation.isChanged() || !status.isOpen()) {
            return List.of();
        }
        String time = TIME_FORMAT.format(Instant.ofEpochSecond(status.time()).atZone(zone));
        String server = Optional.ofNullable(endpoint.param("server")).filter(s -> !s.isBlank()).orElse("Server");
        return List.of(new PlainText("%s opened at %s".formatted(server, time)));
    }
}
