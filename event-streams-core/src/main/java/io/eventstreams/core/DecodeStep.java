package io.eventstreams.core;

import java.util.Objects;

/**
 * Outcome of one {@link IncrementalDecoder} transition.
 *
 * @param <T> emitted element type
 */
public final class DecodeStep<T> {

    public enum Kind {
        /** An element is ready, see {@link #value()}. */
        EMIT,
        /** The decoder cannot make progress without another upstream element. */
        NEEDS_MORE,
        /** State changed without output; poll again. */
        NOOP,
        /** The sequence has ended. */
        END,
        /** The sequence failed, see {@link #error()}. */
        FAIL
    }

    private static final DecodeStep<?> NEEDS_MORE = new DecodeStep<>(Kind.NEEDS_MORE, null, null);
    private static final DecodeStep<?> NOOP = new DecodeStep<>(Kind.NOOP, null, null);
    private static final DecodeStep<?> END = new DecodeStep<>(Kind.END, null, null);

    private final Kind kind;
    private final T value;
    private final EventStreamException error;

    private DecodeStep(Kind kind, T value, EventStreamException error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static <T> DecodeStep<T> emit(T value) {
        return new DecodeStep<>(Kind.EMIT, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> DecodeStep<T> needsMore() {
        return (DecodeStep<T>) NEEDS_MORE;
    }

    @SuppressWarnings("unchecked")
    public static <T> DecodeStep<T> noop() {
        return (DecodeStep<T>) NOOP;
    }

    @SuppressWarnings("unchecked")
    public static <T> DecodeStep<T> end() {
        return (DecodeStep<T>) END;
    }

    public static <T> DecodeStep<T> fail(EventStreamException error) {
        return new DecodeStep<>(Kind.FAIL, null, Objects.requireNonNull(error, "error"));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the emitted element; {@code null} unless {@link #kind()} is {@link Kind#EMIT}
     */
    public T value() {
        return value;
    }

    /**
     * @return the failure; {@code null} unless {@link #kind()} is {@link Kind#FAIL}
     */
    public EventStreamException error() {
        return error;
    }

    @Override
    public String toString() {
        return "DecodeStep{" + kind + '}';
    }
}
