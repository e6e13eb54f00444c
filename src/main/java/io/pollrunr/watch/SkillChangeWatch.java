package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.PlainText;
import io.pollrunr.channel.RenderableItem;
import io.pollrunr.detect.ChangeDetector;
import io.pollrunr.detect.Observation;
import io.pollrunr.detect.StreamKey;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Announces new skill-change records. The newest record's id is the tracked value;
 * the first id seen after startup is only a baseline.
 */
@Component
public class SkillChangeWatch implements Watch {

    static final String NAME = "skill-change";
    static final String PATH = "/data/skills/records";
    static final StreamKey<String> STREAM_KEY = StreamKey.of("skill-info", String.class);

    private final ResultHandler resultHandler;
    private final ChangeDetector changeDetector;

    public SkillChangeWatch(ResultHandler resultHandler, ChangeDetector changeDetector) {
        this.resultHandler = resultHandler;
        this.changeDetector = changeDetector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultCron() {
        return "0 12 * * *";
    }

    @Override
    public List<RenderableItem> poll(Requester requester) {
        return resultHandler.handle(PATH, Map.of(), this::toItems, requester);
    }

    List<RenderableItem> toItems(JsonNode data) {
        JsonNode latest = data.path(0);
        if (latest.isMissingNode() || !latest.hasNonNull("id")) {
            throw new IllegalArgumentException("Skill records response has no entries");
        }
        Observation<String> observation = changeDetector.observe(STREAM_KEY, latest.path("id").asText());
        if (!observation.isChanged()) {
            return List.of();
        }
        String title = latest.path("title").asText("");
        String url = latest.path("url").asText("");
        return List.of(new PlainText(title + ":\n" + url));
    }
}
