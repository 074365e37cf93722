package io.eventstreams.core;

/**
 * Turns items into their exact wire bytes, one item at a time.
 *
 * @param <I> item type
 */
public interface EventSerializer<I> {

    /**
     * Serializes one item.
     *
     * @param item the item, or {@code null} when the upstream is exhausted
     * @return the bytes for {@code item}, or {@code null} once the upstream is exhausted
     * @throws IllegalStateException if called after the serializer finished
     */
    byte[] ingest(I item);

    boolean isFinished();
}
