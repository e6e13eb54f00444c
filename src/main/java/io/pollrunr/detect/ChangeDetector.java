package io.pollrunr.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;

/**
 * Tracks the last observed value per stream and decides whether a new value is news.
 *
 * <p>The first value of a stream is only a baseline. Every read-modify-write on a key runs
 * inside {@link ConcurrentHashMap#compute}, so concurrent observers of the same stream are
 * serialized; different streams do not block each other. State is in-memory only.</p>
 */
@Component
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final ConcurrentMap<String, Object> lastValues = new ConcurrentHashMap<>();

    /**
     * Observes a value, comparing with {@link Objects#equals}.
     */
    public <T> Observation<T> observe(StreamKey<T> key, T value) {
        return observe(key, value, Objects::equals);
    }

    /**
     * Observes a value using the stream's own notion of equality.
     *
     * @param sameValue returns true when the stored and new values carry the same information
     * @throws ClassCastException if the stream holds a value of another type
     */
    public <T> Observation<T> observe(StreamKey<T> key, T value, BiPredicate<? super T, ? super T> sameValue) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(sameValue, "sameValue");

        AtomicReference<Observation<T>> outcome = new AtomicReference<>();
        lastValues.compute(key.name(), (name, stored) -> {
            if (stored == null) {
                outcome.set(Observation.baseline(value));
                return value;
            }
            T previous = key.type().cast(stored);
            if (sameValue.test(previous, value)) {
                outcome.set(Observation.suppressed(previous));
                return stored;
            }
            outcome.set(Observation.changed(previous, value));
            return value;
        });

        Observation<T> observation = outcome.get();
        log.debug("Stream '{}' observed {}: {}", key.name(), observation.kind(), value);
        return observation;
    }

    /**
     * Stores a value without deciding anything about it.
     */
    public <T> void record(StreamKey<T> key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lastValues.put(key.name(), key.type().cast(value));
        log.debug("Stream '{}' recorded: {}", key.name(), value);
    }

    /**
     * Returns the stored value of a stream, if any.
     */
    public <T> Optional<T> current(StreamKey<T> key) {
        return Optional.ofNullable(lastValues.get(key.name())).map(key.type()::cast);
    }

    /**
     * Forgets a stream, so its next observation is a baseline again.
     */
    public boolean reset(StreamKey<?> key) {
        return lastValues.remove(key.name()) != null;
    }

    /** Names of the streams that hold a value. */
    public Set<String> trackedKeys() {
        return Set.copyOf(lastValues.keySet());
    }
}
