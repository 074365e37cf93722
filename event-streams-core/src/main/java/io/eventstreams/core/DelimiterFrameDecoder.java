package io.eventstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Splits a chunked byte stream into frames according to a {@link FramingPolicy}.
 *
 * <p>Bytes are appended to an owned {@link FrameBuffer}; each {@link #poll()} searches it for the
 * next delimiter and emits the payload in front of it, or asks for more bytes. Frame boundaries do
 * not depend on how the input was chunked: feeding one byte per chunk yields the same frames as
 * feeding everything at once.
 *
 * <p>Policy-specific behaviour:
 * <ul>
 *   <li>CR/LF collapsing: after a frame ended with CR, the next byte is inspected once it arrives
 *       and dropped if it is LF, so CRLF counts as a single terminator.</li>
 *   <li>Required first byte: the first byte of the stream, as soon as one arrives, must equal the
 *       policy's byte, otherwise the decoder fails with
 *       {@link EventStreamException.MissingInitialRecordSeparator} before producing any frame.</li>
 *   <li>Empty frames between two delimiters are skipped when the policy says so.</li>
 * </ul>
 */
public final class DelimiterFrameDecoder implements IncrementalDecoder<byte[], byte[]> {

    private static final Logger log = LoggerFactory.getLogger(DelimiterFrameDecoder.class);

    private final FramingPolicy policy;
    private final FrameBuffer buffer = new FrameBuffer();
    private ParserState state;
    // buffered bytes already searched for a delimiter
    private int scanned;

    public DelimiterFrameDecoder(FramingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.state = policy.hasRequiredFirstByte() ? ParserState.INITIAL : ParserState.WAITING_FOR_DELIMITER;
    }

    public ParserState state() {
        return state;
    }

    public FramingPolicy policy() {
        return policy;
    }

    int scannedBytes() {
        return scanned;
    }

    @Override
    public DecodeStep<byte[]> poll() {
        switch (state) {
            case INITIAL:
                return checkFirstByte();
            case WAITING_FOR_DELIMITER:
            case PARSING_RECORD:
                return nextFrame();
            case CONSUMED_CR:
                if (buffer.isEmpty()) return DecodeStep.needsMore();
                if (buffer.byteAt(0) == Ascii.LF) {
                    buffer.discard(1);
                }
                state = ParserState.WAITING_FOR_DELIMITER;
                return DecodeStep.noop();
            case FINISHED:
                return DecodeStep.end();
            default:
                throw new IllegalStateException("unexpected state " + state);
        }
    }

    @Override
    public DecodeStep<byte[]> ingest(byte[] chunk) {
        if (state == ParserState.FINISHED) {
            throw new IllegalStateException("ingest after the " + policy.name() + " decoder finished");
        }
        if (chunk != null) {
            buffer.append(chunk);
            return DecodeStep.noop();
        }
        state = ParserState.FINISHED;
        scanned = 0;
        byte[] remainder = buffer.drain();
        if (remainder.length == 0 || !policy.emitTrailingRemainder()) {
            return DecodeStep.end();
        }
        return DecodeStep.emit(remainder);
    }

    private DecodeStep<byte[]> checkFirstByte() {
        if (buffer.isEmpty()) return DecodeStep.needsMore();
        byte first = buffer.byteAt(0);
        if (first != policy.requiredFirstByte()) {
            state = ParserState.FINISHED;
            buffer.drain();
            log.debug("{} stream starts with 0x{} instead of 0x{}", policy.name(),
                    Integer.toHexString(first & 0xFF), Integer.toHexString(policy.requiredFirstByte() & 0xFF));
            return DecodeStep.fail(new EventStreamException.MissingInitialRecordSeparator(
                    "Missing an initial <RS> character, the bytes might not be a JSON Sequence."));
        }
        buffer.discard(1);
        state = ParserState.PARSING_RECORD;
        return DecodeStep.noop();
    }

    private DecodeStep<byte[]> nextFrame() {
        int index = buffer.indexOfAny(policy.delimiters(), scanned);
        if (index < 0) {
            scanned = buffer.size();
            return DecodeStep.needsMore();
        }
        scanned = 0;
        byte delimiter = buffer.byteAt(index);
        byte[] frame = buffer.take(index, 1);
        if (policy.collapseCrLf() && delimiter == Ascii.CR) {
            state = ParserState.CONSUMED_CR;
        }
        if (frame.length == 0 && policy.skipEmptyFrames()) {
            return DecodeStep.noop();
        }
        return DecodeStep.emit(frame);
    }
}
