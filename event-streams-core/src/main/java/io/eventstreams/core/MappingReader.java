package io.eventstreams.core;

import java.io.IOException;
import java.util.Objects;

final class MappingReader<T, R> implements EventReader<R> {

    private final EventReader<T> upstream;
    private final IoFunction<? super T, ? extends R> fn;
    private boolean done;

    MappingReader(EventReader<T> upstream, IoFunction<? super T, ? extends R> fn) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    @Override
    public R next() throws IOException {
        if (done) return null;
        try {
            T value = upstream.next();
            if (value == null) {
                done = true;
                return null;
            }
            return Objects.requireNonNull(fn.apply(value), "mapped element");
        } catch (IOException | RuntimeException e) {
            done = true;
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        upstream.close();
    }
}
