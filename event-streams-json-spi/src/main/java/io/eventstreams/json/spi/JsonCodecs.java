package io.eventstreams.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovery of {@link JsonCodec} implementations backed by {@link ServiceLoader}.
 *
 * <p>Discovery only produces a codec; callers still hand it explicitly to every encoder and decoder.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Finds the first registered provider and creates a codec with the given options.
     *
     * @param cl class loader to search
     * @param options encoding options
     * @return the codec, or empty when no provider is registered
     */
    public static Optional<JsonCodec> load(ClassLoader cl, JsonEncodingOptions options) {
        Objects.requireNonNull(cl, "cl");
        Objects.requireNonNull(options, "options");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) return Optional.empty();
        return Optional.of(it.next().create(options));
    }

    /**
     * Same as {@link #load(ClassLoader, JsonEncodingOptions)} using the context class loader and
     * {@link JsonEncodingOptions#defaults()}.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec loadDefault() {
        return load(Thread.currentThread().getContextClassLoader(), JsonEncodingOptions.defaults())
                .orElseThrow(() -> new IllegalStateException("no JsonCodecProvider registered"));
    }
}
