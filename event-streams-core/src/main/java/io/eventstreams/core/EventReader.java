package io.eventstreams.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass, pull-based sequence of elements.
 *
 * <p>Used both for raw byte chunks coming from a transport and for the frames, events and
 * serialized chunks produced from them. {@link #next()} blocks only while waiting for the
 * upstream to deliver more data.
 *
 * <p>Once {@code next()} has returned {@code null} or thrown, the reader is finished and every
 * later call returns {@code null}. A finished reader cannot be restarted; a new pass needs a new
 * source. Instances are not thread-safe and must be driven by one consumer at a time.
 *
 * @param <T> element type
 */
public interface EventReader<T> extends Closeable {

    /**
     * Returns the next element.
     *
     * @return the next element, or {@code null} when the sequence has ended
     * @throws IOException if the upstream fails or the element cannot be decoded
     */
    T next() throws IOException;

    @Override
    default void close() throws IOException {
    }

    /**
     * Drains the remaining elements into a list.
     */
    default List<T> readAll() throws IOException {
        List<T> out = new ArrayList<>();
        T value;
        while ((value = next()) != null) {
            out.add(value);
        }
        return out;
    }

    /**
     * Returns a reader applying {@code fn} to every element. Closing it closes this reader.
     */
    default <R> EventReader<R> map(IoFunction<? super T, ? extends R> fn) {
        return new MappingReader<>(this, fn);
    }

    static <T> EventReader<T> empty() {
        return () -> null;
    }

    static <T> EventReader<T> of(List<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return fromIterator(List.copyOf(values).iterator());
    }

    static <T> EventReader<T> fromIterator(Iterator<? extends T> it) {
        Objects.requireNonNull(it, "it");
        return () -> it.hasNext() ? Objects.requireNonNull(it.next(), "element") : null;
    }
}
