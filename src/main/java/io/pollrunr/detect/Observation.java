package io.pollrunr.detect;

/**
 * Result of feeding one value into a {@link ChangeDetector} stream.
 *
 * @param kind     what the detector decided
 * @param previous the stored value before this observation (null for BASELINE)
 * @param current  the stored value after this observation
 */
public record Observation<T>(Kind kind, T previous, T current) {

    public enum Kind {
        /** First value seen for the stream; stored, not a change. */
        BASELINE,
        /** Same as the stored value; nothing new. */
        SUPPRESSED,
        /** Differs from the stored value; worth notifying. */
        CHANGED
    }

    static <T> Observation<T> baseline(T value) {
        return new Observation<>(Kind.BASELINE, null, value);
    }

    static <T> Observation<T> suppressed(T stored) {
        return new Observation<>(Kind.SUPPRESSED, stored, stored);
    }

    static <T> Observation<T> changed(T previous, T current) {
        return new Observation<>(Kind.CHANGED, previous, current);
    }

    public boolean isChanged() {
        return kind == Kind.CHANGED;
    }
}
