package io.eventstreams.json.spi;

import java.io.IOException;

/**
 * Base exception for JSON serialization and deserialization errors.
 *
 * <p>Extends {@link IOException} so it travels through the event stream readers, whose pull
 * methods declare {@code throws IOException}, without being wrapped.
 */
public class JsonException extends IOException {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public JsonException(Throwable cause) {
        super(cause);
    }
}
