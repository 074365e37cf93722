package io.eventstreams.core;

import java.io.IOException;
import java.util.Objects;

/**
 * Pulls items from an upstream reader and hands out their serialized bytes.
 */
public final class SerializingReader<I> implements EventReader<byte[]> {

    private final EventReader<? extends I> upstream;
    private final EventSerializer<I> serializer;
    private boolean done;

    public SerializingReader(EventReader<? extends I> upstream, EventSerializer<I> serializer) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public byte[] next() throws IOException {
        if (done || serializer.isFinished()) return null;
        try {
            byte[] bytes = serializer.ingest(upstream.next());
            if (bytes == null) done = true;
            return bytes;
        } catch (IOException | RuntimeException e) {
            done = true;
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        done = true;
        upstream.close();
    }
}
