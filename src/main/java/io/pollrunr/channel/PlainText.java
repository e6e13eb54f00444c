package io.pollrunr.channel;

import java.util.Objects;

/**
 * A text notification item.
 */
public record PlainText(String text) implements RenderableItem {

    public PlainText {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String asText() {
        return text;
    }
}
