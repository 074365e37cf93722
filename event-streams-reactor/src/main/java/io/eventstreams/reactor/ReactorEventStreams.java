package io.eventstreams.reactor;

import io.eventstreams.core.DecodeStep;
import io.eventstreams.core.DelimiterFrameDecoder;
import io.eventstreams.core.EventReader;
import io.eventstreams.core.EventSerializer;
import io.eventstreams.core.EventStreams;
import io.eventstreams.core.FramingPolicy;
import io.eventstreams.core.IncrementalDecoder;
import io.eventstreams.core.JsonSequenceSerializer;
import io.eventstreams.core.LinesSerializer;
import io.eventstreams.core.ServerSentEvent;
import io.eventstreams.core.ServerSentEventAssembler;
import io.eventstreams.core.ServerSentEventWithJsonData;
import io.eventstreams.core.ServerSentEventsSerializer;
import io.eventstreams.json.spi.JsonCodec;
import io.eventstreams.json.spi.JsonException;
import io.eventstreams.reactive.FlowInterop;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Reactor operators over chunked bodies.
 *
 * <p>Every returned {@link Flux} is cold: each subscription gets its own state machine and
 * subscribes to the upstream once. Upstream chunks are requested one at a time as the decoder
 * needs them. Structural and JSON failures terminate the flux with the same exceptions the
 * blocking {@link EventStreams} readers throw.
 */
public final class ReactorEventStreams {

    private static final Logger log = LoggerFactory.getLogger(ReactorEventStreams.class);

    private ReactorEventStreams() {}

    /**
     * Drives a fresh decoder per subscription.
     *
     * @param upstream upstream elements
     * @param decoders creates the decoder for one subscription
     */
    public static <I, O> Flux<O> decode(
            Publisher<? extends I> upstream,
            Supplier<? extends IncrementalDecoder<I, O>> decoders
    ) {
        Objects.requireNonNull(upstream, "upstream");
        Objects.requireNonNull(decoders, "decoders");
        return Flux.defer(() -> {
            DecoderPump<I, O> pump = new DecoderPump<>(decoders.get());
            return Flux.<I>from(upstream)
                    .map(Optional::of)
                    .concatWith(Mono.just(Optional.<I>empty()))
                    .concatMapIterable(pump::feed, 1)
                    .takeWhile(step -> step.kind() != DecodeStep.Kind.END)
                    .<O>handle((step, sink) -> {
                        if (step.kind() == DecodeStep.Kind.FAIL) {
                            sink.error(step.error());
                        } else {
                            sink.next(step.value());
                        }
                    });
        });
    }

    // ===== Lines =====

    public static Flux<byte[]> decodeLines(Publisher<byte[]> chunks) {
        return decode(chunks, () -> new DelimiterFrameDecoder(FramingPolicy.lines()));
    }

    public static Flux<byte[]> encodeLines(Publisher<byte[]> lines) {
        return serialize(lines, LinesSerializer::new);
    }

    // ===== JSON Lines =====

    public static <T> Flux<T> decodeJsonLines(Publisher<byte[]> chunks, Class<T> type, JsonCodec codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeLines(chunks).handle((line, sink) -> {
            try {
                sink.next(EventStreams.readJsonValue(codec, line, type));
            } catch (JsonException e) {
                sink.error(e);
            }
        });
    }

    public static <T> Flux<byte[]> encodeJsonLines(Publisher<T> values, JsonCodec codec) {
        return encodeLines(toJsonBytes(values, codec));
    }

    // ===== JSON Sequence =====

    public static Flux<byte[]> decodeJsonSequenceFrames(Publisher<byte[]> chunks) {
        return decode(chunks, () -> new DelimiterFrameDecoder(FramingPolicy.jsonSequence()));
    }

    public static <T> Flux<T> decodeJsonSequence(Publisher<byte[]> chunks, Class<T> type, JsonCodec codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeJsonSequenceFrames(chunks).handle((record, sink) -> {
            try {
                sink.next(EventStreams.readJsonValue(codec, record, type));
            } catch (JsonException e) {
                sink.error(e);
            }
        });
    }

    public static Flux<byte[]> encodeJsonSequenceFrames(Publisher<byte[]> records) {
        return serialize(records, JsonSequenceSerializer::new);
    }

    public static <T> Flux<byte[]> encodeJsonSequence(Publisher<T> values, JsonCodec codec) {
        return encodeJsonSequenceFrames(toJsonBytes(values, codec));
    }

    // ===== Server-Sent Events =====

    public static Flux<byte[]> decodeServerSentEventLines(Publisher<byte[]> chunks) {
        return decode(chunks, () -> new DelimiterFrameDecoder(FramingPolicy.serverSentEventLines()));
    }

    public static Flux<ServerSentEvent> decodeServerSentEvents(Publisher<byte[]> chunks) {
        return decodeServerSentEvents(chunks, null);
    }

    /**
     * @param continueWhile see {@link ServerSentEventAssembler#ServerSentEventAssembler(Predicate)};
     *                      when it stops the stream the upstream is cancelled. May be {@code null}.
     */
    public static Flux<ServerSentEvent> decodeServerSentEvents(
            Publisher<byte[]> chunks,
            Predicate<String> continueWhile
    ) {
        return decode(decodeServerSentEventLines(chunks), () -> new ServerSentEventAssembler(continueWhile));
    }

    public static <T> Flux<ServerSentEventWithJsonData<T>> decodeServerSentEventsWithJsonData(
            Publisher<byte[]> chunks,
            Class<T> type,
            JsonCodec codec
    ) {
        return decodeServerSentEventsWithJsonData(chunks, type, codec, null);
    }

    public static <T> Flux<ServerSentEventWithJsonData<T>> decodeServerSentEventsWithJsonData(
            Publisher<byte[]> chunks,
            Class<T> type,
            JsonCodec codec,
            Predicate<String> continueWhile
    ) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(codec, "codec");
        return decodeServerSentEvents(chunks, continueWhile).handle((event, sink) -> {
            try {
                sink.next(EventStreams.withJsonData(event, type, codec));
            } catch (JsonException e) {
                sink.error(e);
            }
        });
    }

    public static Flux<byte[]> encodeServerSentEvents(Publisher<ServerSentEvent> events) {
        return serialize(events, ServerSentEventsSerializer::new);
    }

    public static <T> Flux<byte[]> encodeServerSentEventsWithJsonData(
            Publisher<ServerSentEventWithJsonData<T>> events,
            JsonCodec codec
    ) {
        Objects.requireNonNull(codec, "codec");
        Flux<ServerSentEvent> withStrings = Flux.from(events).handle((event, sink) -> {
            try {
                sink.next(EventStreams.withStringData(event, codec));
            } catch (JsonException e) {
                sink.error(e);
            }
        });
        return encodeServerSentEvents(withStrings);
    }

    // ===== Sources and interop =====

    /**
     * Copies the remaining bytes of each buffer; the buffers' positions are left untouched.
     */
    public static Flux<byte[]> fromByteBuffers(Publisher<ByteBuffer> buffers) {
        Objects.requireNonNull(buffers, "buffers");
        return Flux.from(buffers).map(buffer -> {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.duplicate().get(bytes);
            return bytes;
        });
    }

    /**
     * Emits the elements of a blocking reader on the subscribing thread and closes it on
     * termination or cancellation. Combine with {@code subscribeOn} when {@code next()} blocks.
     */
    public static <T> Flux<T> fromReader(Supplier<? extends EventReader<T>> readers) {
        Objects.requireNonNull(readers, "readers");
        return Flux.<T, EventReader<T>>using(
                readers::get,
                reader -> Flux.<T>generate(sink -> {
                    try {
                        T value = reader.next();
                        if (value == null) {
                            sink.complete();
                        } else {
                            sink.next(value);
                        }
                    } catch (IOException e) {
                        sink.error(e);
                    }
                }),
                ReactorEventStreams::closeQuietly
        );
    }

    public static <T> Flux<T> fromFlow(Flow.Publisher<T> publisher) {
        return Flux.from(FlowInterop.toReactiveStreams(publisher));
    }

    public static <T> Flow.Publisher<T> toFlow(Publisher<T> publisher) {
        return FlowInterop.toFlow(publisher);
    }

    private static <T> Flux<byte[]> toJsonBytes(Publisher<T> values, JsonCodec codec) {
        Objects.requireNonNull(codec, "codec");
        return Flux.from(values).handle((value, sink) -> {
            try {
                sink.next(codec.writeBytes(value));
            } catch (JsonException e) {
                sink.error(e);
            }
        });
    }

    private static <I> Flux<byte[]> serialize(Publisher<? extends I> items, Supplier<? extends EventSerializer<I>> serializers) {
        Objects.requireNonNull(items, "items");
        return Flux.defer(() -> {
            EventSerializer<I> serializer = serializers.get();
            return Flux.<I>from(items).map(serializer::ingest);
        });
    }

    private static void closeQuietly(EventReader<?> reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Failed to close event reader", e);
        }
    }
}
