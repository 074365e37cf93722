package io.eventstreams.core;

import io.eventstreams.json.spi.JsonCodec;
import io.eventstreams.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Entry points for decoding chunked bodies into events and encoding events into chunked bodies.
 *
 * <p>Decoders take an {@link EventReader} of raw byte chunks as delivered by a transport, with any
 * chunking. Encoders return an {@link EventReader} of serialized chunks, one per item. All
 * readers are single-pass; closing a returned reader closes its upstream.
 *
 * <pre>{@code
 * JsonCodec codec = JacksonJsonCodec.create(JsonEncodingOptions.defaults());
 * try (EventReader<ServerSentEventWithJsonData<Delta>> events = EventStreams.decodeServerSentEventsWithJsonData(
 *         ByteChunks.fromInputStream(response.body()), Delta.class, codec, data -> !data.equals("[DONE]"))) {
 *     ServerSentEventWithJsonData<Delta> e;
 *     while ((e = events.next()) != null) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class EventStreams {
    private EventStreams() {}

    // ===== Lines =====

    /**
     * LF-terminated lines; a last line without LF is still returned.
     */
    public static EventReader<byte[]> decodeLines(EventReader<byte[]> chunks) {
        return new DecodingReader<>(chunks, new DelimiterFrameDecoder(FramingPolicy.lines()));
    }

    public static EventReader<byte[]> encodeLines(EventReader<byte[]> lines) {
        return new SerializingReader<>(lines, new LinesSerializer());
    }

    // ===== JSON Lines =====

    public static <T> EventReader<T> decodeJsonLines(EventReader<byte[]> chunks, Class<T> type, JsonCodec codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeLines(chunks).map(line -> readJsonValue(codec, line, type));
    }

    public static <T> EventReader<byte[]> encodeJsonLines(EventReader<T> values, JsonCodec codec) {
        Objects.requireNonNull(codec, "codec");
        return encodeLines(values.map(codec::writeBytes));
    }

    // ===== JSON Sequence =====

    /**
     * Raw RFC 7464 records. Throws {@link EventStreamException.MissingInitialRecordSeparator} when
     * the stream does not start with {@code <RS>}.
     */
    public static EventReader<byte[]> decodeJsonSequenceFrames(EventReader<byte[]> chunks) {
        return new DecodingReader<>(chunks, new DelimiterFrameDecoder(FramingPolicy.jsonSequence()));
    }

    public static <T> EventReader<T> decodeJsonSequence(EventReader<byte[]> chunks, Class<T> type, JsonCodec codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeJsonSequenceFrames(chunks).map(record -> readJsonValue(codec, record, type));
    }

    public static EventReader<byte[]> encodeJsonSequenceFrames(EventReader<byte[]> records) {
        return new SerializingReader<>(records, new JsonSequenceSerializer());
    }

    public static <T> EventReader<byte[]> encodeJsonSequence(EventReader<T> values, JsonCodec codec) {
        Objects.requireNonNull(codec, "codec");
        return encodeJsonSequenceFrames(values.map(codec::writeBytes));
    }

    // ===== Server-Sent Events =====

    /**
     * Lines terminated by LF, CR or CRLF.
     */
    public static EventReader<byte[]> decodeServerSentEventLines(EventReader<byte[]> chunks) {
        return new DecodingReader<>(chunks, new DelimiterFrameDecoder(FramingPolicy.serverSentEventLines()));
    }

    public static EventReader<ServerSentEvent> decodeServerSentEvents(EventReader<byte[]> chunks) {
        return decodeServerSentEvents(chunks, null);
    }

    /**
     * @param continueWhile see {@link ServerSentEventAssembler#ServerSentEventAssembler(Predicate)}; may be {@code null}
     */
    public static EventReader<ServerSentEvent> decodeServerSentEvents(
            EventReader<byte[]> chunks,
            Predicate<String> continueWhile
    ) {
        return new DecodingReader<>(decodeServerSentEventLines(chunks), new ServerSentEventAssembler(continueWhile));
    }

    public static <T> EventReader<ServerSentEventWithJsonData<T>> decodeServerSentEventsWithJsonData(
            EventReader<byte[]> chunks,
            Class<T> type,
            JsonCodec codec
    ) {
        return decodeServerSentEventsWithJsonData(chunks, type, codec, null);
    }

    public static <T> EventReader<ServerSentEventWithJsonData<T>> decodeServerSentEventsWithJsonData(
            EventReader<byte[]> chunks,
            Class<T> type,
            JsonCodec codec,
            Predicate<String> continueWhile
    ) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeServerSentEvents(chunks, continueWhile).map(event -> withJsonData(event, type, codec));
    }

    public static EventReader<byte[]> encodeServerSentEvents(EventReader<ServerSentEvent> events) {
        return new SerializingReader<>(events, new ServerSentEventsSerializer());
    }

    public static <T> EventReader<byte[]> encodeServerSentEventsWithJsonData(
            EventReader<ServerSentEventWithJsonData<T>> events,
            JsonCodec codec
    ) {
        Objects.requireNonNull(codec, "codec");
        return encodeServerSentEvents(events.map(event -> withStringData(event, codec)));
    }

    /**
     * Decodes the data field of {@code event} with {@code codec}; absent data stays absent.
     */
    public static <T> ServerSentEventWithJsonData<T> withJsonData(ServerSentEvent event, Class<T> type, JsonCodec codec)
            throws JsonException {
        Optional<T> data = Optional.empty();
        if (event.data().isPresent()) {
            data = Optional.of(readJsonValue(codec, event.data().get().getBytes(StandardCharsets.UTF_8), type));
        }
        return new ServerSentEventWithJsonData<>(event.event(), data, event.id(), event.retry());
    }

    /**
     * Encodes the data field of {@code event} with {@code codec}; absent data stays absent.
     */
    public static ServerSentEvent withStringData(ServerSentEventWithJsonData<?> event, JsonCodec codec)
            throws JsonException {
        Optional<String> data = Optional.empty();
        if (event.data().isPresent()) {
            data = Optional.of(codec.writeString(event.data().get()));
        }
        return new ServerSentEvent(event.id(), event.event(), data, event.retry());
    }

    /**
     * Decodes one payload, failing with {@link JsonException} rather than yielding {@code null}
     * when the payload is a JSON {@code null}.
     */
    public static <T> T readJsonValue(JsonCodec codec, byte[] json, Class<T> type) throws JsonException {
        T value = codec.readValue(json, type);
        if (value == null) {
            throw new JsonException("JSON null is not a value of " + type.getName());
        }
        return value;
    }
}
