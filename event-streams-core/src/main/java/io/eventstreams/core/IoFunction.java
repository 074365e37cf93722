package io.eventstreams.core;

import java.io.IOException;

/**
 * Function that may fail with an {@link IOException}, typically a JSON codec call.
 */
@FunctionalInterface
public interface IoFunction<T, R> {
    R apply(T value) throws IOException;
}
