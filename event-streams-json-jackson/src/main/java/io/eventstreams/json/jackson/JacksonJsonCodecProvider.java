package io.eventstreams.json.jackson;

import io.eventstreams.json.spi.JsonCodec;
import io.eventstreams.json.spi.JsonCodecProvider;
import io.eventstreams.json.spi.JsonEncodingOptions;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec create(JsonEncodingOptions options) {
        return JacksonJsonCodec.create(options);
    }
}
