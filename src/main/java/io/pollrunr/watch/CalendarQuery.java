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
 * Activity calendar for the days around today, one line per day. Today's line is starred.
 */
@Component
public class CalendarQuery implements Query {

    static final String NAME = "calendar";
    static final String PATH = "/data/active/list/calendar";
    static final int DAYS = 7;

    private final ResultHandler resultHandler;

    public CalendarQuery(ResultHandler resultHandler) {
        this.resultHandler = resultHandler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<RenderableItem> run(Requester requester, Map<String, String> args) {
        Objects.requireNonNull(requester, "requester");
        return resultHandler.handle(PATH, Map.of("num", DAYS), this::render, requester);
    }

    List<RenderableItem> render(JsonNode data) {
        JsonNode days = data.path("data");
        if (!days.isArray()) {
            throw new IllegalArgumentException("Calendar response has no day list");
        }
        if (days.isEmpty()) {
            return List.of();
        }
        String today = data.path("today").path("date").asText("");
        List<String> lines = new ArrayList<>();
        for (JsonNode day : days) {
            String date = day.path("date").asText("");
            StringBuilder line = new StringBuilder(date.equals(today) ? "* " : "  ")
                    .append(date).append(" (").append(day.path("week").asText("")).append(")")
                    .append(" | Battlefield: ").append(day.path("battle").asText(""))
                    .append(" | War: ").append(day.path("war").asText(""))
                    .append(" | School: ").append(day.path("school").asText(""))
                    .append(" | Rescue: ").append(day.path("rescue").asText(""));
            String draw = day.path("draw").asText("");
            if (!draw.isBlank()) {
                line.append(" | Drawing: ").append(draw);
            }
            lines.add(line.toString());
        }
        return List.of(new PlainText(String.join("\n", lines)));
    }
}
