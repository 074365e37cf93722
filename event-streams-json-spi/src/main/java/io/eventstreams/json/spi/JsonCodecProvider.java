package io.eventstreams.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.eventstreams.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Creates a codec honouring the given options.
     *
     * @param options encoding options
     * @return a new codec
     */
    JsonCodec create(JsonEncodingOptions options);
}
