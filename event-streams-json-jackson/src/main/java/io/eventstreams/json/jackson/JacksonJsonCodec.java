package io.eventstreams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.eventstreams.json.spi.JsonCodec;
import io.eventstreams.json.spi.JsonEncodingOptions;
import io.eventstreams.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>Use {@link #create(JsonEncodingOptions)} to get a mapper configured from explicit options, or
 * wrap an existing {@link ObjectMapper} when the application already owns one:
 * <pre>{@code
 * JsonCodec codec = JacksonJsonCodec.create(JsonEncodingOptions.defaults());
 * EventReader<Pet> pets = EventStreams.decodeJsonLines(body, Pet.class, codec);
 * }</pre>
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;
    private final JsonEncodingOptions options;

    /**
     * Creates a Jackson codec with {@link JsonEncodingOptions#defaults()}.
     */
    public JacksonJsonCodec() {
        this(newMapper(JsonEncodingOptions.defaults()), JsonEncodingOptions.defaults());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper. The mapper is used as-is.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this(mapper, optionsOf(mapper));
    }

    private JacksonJsonCodec(ObjectMapper mapper, JsonEncodingOptions options) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Creates a codec whose mapper honours the given options.
     *
     * @param options encoding options
     * @return the codec
     */
    public static JacksonJsonCodec create(JsonEncodingOptions options) {
        Objects.requireNonNull(options, "options");
        return new JacksonJsonCodec(newMapper(options), options);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public JsonEncodingOptions options() {
        return options;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Cannot encode " + typeName(value) + " as JSON bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Cannot encode " + typeName(value) + " as JSON text", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Cannot decode JSON bytes as " + type.getName(), e);
        }
        return nonNull(value, type);
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Cannot decode JSON text as " + type.getName(), e);
        }
        return nonNull(value, type);
    }

    private static <T> T nonNull(T value, Class<T> type) throws JsonException {
        if (value == null) {
            throw new JsonException("JSON null is not a value of " + type.getName());
        }
        return value;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    static ObjectMapper newMapper(JsonEncodingOptions options) {
        JsonFactory factory = options.escapeForwardSlashes()
                ? new JsonFactoryBuilder().characterEscapes(new SlashEscapes()).build()
                : new JsonFactory();
        return JsonMapper.builder(factory)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, options.sortedKeys())
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, options.sortedKeys())
                .build();
    }

    private static JsonEncodingOptions optionsOf(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        boolean sorted = mapper.isEnabled(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                && mapper.isEnabled(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return new JsonEncodingOptions(sorted, mapper.getFactory().getCharacterEscapes() instanceof SlashEscapes);
    }

    /**
     * Standard JSON escapes plus {@code /} written as {@code \/}.
     */
    static final class SlashEscapes extends CharacterEscapes {
        private static final SerializedString ESCAPED_SLASH = new SerializedString("\\/");

        private final int[] asciiEscapes;

        SlashEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            escapes['/'] = CharacterEscapes.ESCAPE_CUSTOM;
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return ch == '/' ? ESCAPED_SLASH : null;
        }
    }
}
