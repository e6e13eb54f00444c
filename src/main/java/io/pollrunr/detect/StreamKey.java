package io.pollrunr.detect;

import java.util.Objects;

/**
 * Names a tracked stream and the type of value stored for it.
 *
 * @param name unique stream name
 * @param type class of the values observed on this stream
 */
public record StreamKey<T>(String name, Class<T> type) {

    public StreamKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static <T> StreamKey<T> of(String name, Class<T> type) {
        return new StreamKey<>(name, type);
    }
}
