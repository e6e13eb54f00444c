package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.PlainText;
import io.pollrunr.channel.RenderableItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Upcoming events of a faction (the {@code name} argument), at most {@link #MAX_EVENTS} of them.
 */
@Component
public class CelebsQuery implements Query {

    static final String NAME = "celebs";
    static final String PATH = "/data/active/celebs";
    static final String ARG_NAME = "name";
    static final int MAX_EVENTS = 12;

    private final ResultHandler resultHandler;

    public CelebsQuery(ResultHandler resultHandler) {
        this.resultHandler = resultHandler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredArgs() {
        return Set.of(ARG_NAME);
    }

    @Override
    public List<RenderableItem> run(Requester requester, Map<String, String> args) {
        Objects.requireNonNull(requester, "requester");
        String faction = args.get(ARG_NAME);
        if (faction == null || faction.isBlank()) {
            throw new IllegalArgumentException("Query '" + NAME + "' needs a '" + ARG_NAME + "' argument");
        }
        return resultHandler.handle(PATH, Map.of(ARG_NAME, faction.trim()), this::render, requester);
    }

    List<RenderableItem> render(JsonNode data) {
        if (!data.isArray()) {
            throw new IllegalArgumentException("Celebs response is not a list");
        }
        List<String> events = new ArrayList<>();
        for (int i = 0; i < data.size() && i < MAX_EVENTS; i++) {
            JsonNode event = data.path(i);
            events.add("[" + event.path("time").asText("") + "] " + event.path("stage").asText("") + "\n"
                    + "● " + event.path("map").asText("") + "-" + event.path("site").asText("") + "\n"
                    + event.path("desc").asText(""));
        }
        if (events.isEmpty()) {
            return List.of();
        }
        return List.of(new PlainText(String.join("\n\n", events)));
    }
}
