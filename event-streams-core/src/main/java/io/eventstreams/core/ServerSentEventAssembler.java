package io.eventstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;
import java.util.function.Predicate;

/**
 * Accumulates Server-Sent Events lines into {@link ServerSentEvent}s.
 *
 * <p>Input lines must already be split by the {@link FramingPolicy#serverSentEventLines()} framer.
 * Per line:
 * <ul>
 *   <li>empty: the accumulated event is dispatched; one trailing LF of the data is removed</li>
 *   <li>starting with {@code :}: comment, ignored</li>
 *   <li>{@code field:value} with at most one leading space stripped from the value;
 *       {@code event}, {@code id} overwrite, {@code data} appends value plus LF,
 *       {@code retry} is stored when it is an integer and skipped otherwise,
 *       any other field is ignored</li>
 * </ul>
 *
 * <p>When the upstream ends in the middle of an event, that event is discarded: pending data
 * must not be dispatched without the closing blank line.
 */
public final class ServerSentEventAssembler implements IncrementalDecoder<byte[], ServerSentEvent> {

    private static final Logger log = LoggerFactory.getLogger(ServerSentEventAssembler.class);

    private final Predicate<String> continueWhile;
    private final Deque<byte[]> lines = new ArrayDeque<>();
    private Accumulator current = new Accumulator();
    private ParserState state = ParserState.WAITING_FOR_DELIMITER;

    public ServerSentEventAssembler() {
        this(null);
    }

    /**
     * @param continueWhile tested against the data of every dispatched event that has data; when it
     *                      returns {@code false} the event is dropped and the sequence ends.
     *                      May be {@code null}.
     */
    public ServerSentEventAssembler(Predicate<String> continueWhile) {
        this.continueWhile = continueWhile;
    }

    public ParserState state() {
        return state;
    }

    @Override
    public DecodeStep<ServerSentEvent> poll() {
        if (state == ParserState.FINISHED) return DecodeStep.end();
        byte[] line = lines.pollFirst();
        if (line == null) return DecodeStep.needsMore();

        if (line.length == 0) {
            ServerSentEvent event = current.dispatch();
            current = new Accumulator();
            if (event.data().isPresent() && continueWhile != null && !continueWhile.test(event.data().get())) {
                log.debug("Event stream terminated by data sentinel");
                finish();
                return DecodeStep.end();
            }
            return DecodeStep.emit(event);
        }
        if (line[0] == Ascii.COLON) {
            return DecodeStep.noop();
        }
        int colon = indexOf(line, Ascii.COLON);
        if (colon < 0) {
            return DecodeStep.noop();
        }
        int valueStart = colon + 1;
        if (valueStart < line.length && line[valueStart] == Ascii.SPACE) {
            valueStart++;
        }
        String field = new String(line, 0, colon, StandardCharsets.UTF_8);
        String value = new String(line, valueStart, line.length - valueStart, StandardCharsets.UTF_8);
        current.apply(field, value);
        return DecodeStep.noop();
    }

    @Override
    public DecodeStep<ServerSentEvent> ingest(byte[] line) {
        if (state == ParserState.FINISHED) {
            throw new IllegalStateException("ingest after the event assembler finished");
        }
        if (line != null) {
            lines.addLast(line);
            return DecodeStep.noop();
        }
        if (current.touched) {
            log.debug("Event stream ended inside an event; discarding the incomplete event");
        }
        finish();
        return DecodeStep.end();
    }

    private void finish() {
        state = ParserState.FINISHED;
        lines.clear();
        current = new Accumulator();
    }

    private static int indexOf(byte[] line, byte b) {
        for (int i = 0; i < line.length; i++) {
            if (line[i] == b) return i;
        }
        return -1;
    }

    /**
     * Parses a {@code retry} value; an unparsable value yields empty.
     */
    static OptionalLong parseRetry(String value) {
        int len = value.length();
        if (len == 0) return OptionalLong.empty();
        int i = (value.charAt(0) == '+' || value.charAt(0) == '-') ? 1 : 0;
        if (i == len) return OptionalLong.empty();
        for (; i < len; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException overflow) {
            return OptionalLong.empty();
        }
    }

    private static final class Accumulator {
        private String id;
        private String event;
        private StringBuilder data;
        private Long retry;
        private boolean touched;

        void apply(String field, String value) {
            switch (field) {
                case "event":
                    event = value;
                    break;
                case "data":
                    if (data == null) data = new StringBuilder();
                    data.append(value).append('\n');
                    break;
                case "id":
                    id = value;
                    break;
                case "retry":
                    OptionalLong parsed = parseRetry(value);
                    if (parsed.isEmpty()) return;
                    retry = parsed.getAsLong();
                    break;
                default:
                    return;
            }
            touched = true;
        }

        ServerSentEvent dispatch() {
            ServerSentEvent.Builder b = ServerSentEvent.builder().id(id).event(event);
            if (data != null) {
                int len = data.length();
                if (len > 0 && data.charAt(len - 1) == '\n') {
                    data.setLength(len - 1);
                }
                b.data(data.toString());
            }
            if (retry != null) b.retry(retry);
            return b.build();
        }
    }
}
