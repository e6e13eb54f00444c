package io.pollrunr.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.pollrunr.channel.PlainText;
import io.pollrunr.channel.RenderableItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Today's activities: the rotating war, battlefield, ore cart, school and rescue events,
 * plus lucky pets, the featured drawing and the weekly team dungeons when present.
 */
@Component
public class DailyQuery implements Query {

    static final String NAME = "daily";
    static final String PATH = "/data/active/calendar";

    private static final String[] TEAM_LABELS = {"Public weekly", "5-player weekly", "10-player weekly"};

    private final ResultHandler resultHandler;

    public DailyQuery(ResultHandler resultHandler) {
        this.resultHandler = resultHandler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<RenderableItem> run(Requester requester, Map<String, String> args) {
        Objects.requireNonNull(requester, "requester");
        return resultHandler.handle(PATH, Map.of("num", 0), this::render, requester);
    }

    List<RenderableItem> render(JsonNode data) {
        if (!data.hasNonNull("date")) {
            throw new IllegalArgumentException("Daily response has no date");
        }
        List<String> lines = new ArrayList<>();
        lines.add(data.path("date").asText() + " (" + data.path("week").asText("") + ")");
        lines.add("War: " + data.path("war").asText(""));
        lines.add("Battlefield: " + data.path("battle").asText(""));
        lines.add("Ore cart: " + data.path("orecar").asText(""));
        lines.add("School: " + data.path("school").asText(""));
        lines.add("Rescue: " + data.path("rescue").asText(""));

        JsonNode luck = data.path("luck");
        if (luck.isArray() && !luck.isEmpty()) {
            List<String> pets = new ArrayList<>();
            luck.forEach(pet -> pets.add(pet.asText()));
            lines.add("Luck: " + String.join(", ", pets));
        }
        String draw = data.path("draw").asText("");
        if (!draw.isBlank()) {
            lines.add("Drawing: " + draw);
        }
        JsonNode team = data.path("team");
        for (int i = 0; i < TEAM_LABELS.length && i < team.size(); i++) {
            lines.add(TEAM_LABELS[i] + ":");
            for (String entry : team.path(i).asText("").split(";")) {
                if (!entry.isBlank()) {
                    lines.add("• " + entry.trim());
                }
            }
        }
        return List.of(new PlainText(String.join("\n", lines)));
    }
}
