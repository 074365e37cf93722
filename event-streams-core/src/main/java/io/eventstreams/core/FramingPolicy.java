package io.eventstreams.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * The points on which the framers built by {@link DelimiterFrameDecoder} differ.
 *
 * <ul>
 *   <li>{@link #lines()}: LF-terminated lines</li>
 *   <li>{@link #serverSentEventLines()}: LF, CR or CRLF terminated lines</li>
 *   <li>{@link #jsonSequence()}: RS-prefixed records (RFC 7464)</li>
 * </ul>
 */
public final class FramingPolicy {

    private static final FramingPolicy LINES =
            new FramingPolicy("lines", new byte[] {Ascii.LF}, false, null, false, true);

    private static final FramingPolicy SSE_LINES =
            new FramingPolicy("sse-lines", new byte[] {Ascii.LF, Ascii.CR}, true, null, false, true);

    private static final FramingPolicy JSON_SEQUENCE =
            new FramingPolicy("json-seq", new byte[] {Ascii.RS}, false, Ascii.RS, true, true);

    private final String name;
    private final byte[] delimiters;
    private final boolean collapseCrLf;
    private final Byte requiredFirstByte;
    private final boolean skipEmptyFrames;
    private final boolean emitTrailingRemainder;

    /**
     * @param name label used in diagnostics
     * @param delimiters bytes that end a frame
     * @param collapseCrLf when a frame ends with CR, drop a directly following LF
     * @param requiredFirstByte byte the stream must start with, consumed before the first frame; may be {@code null}
     * @param skipEmptyFrames do not emit zero-length frames found between two delimiters
     * @param emitTrailingRemainder at end of stream, emit a non-empty undelimited remainder as a last frame
     */
    public FramingPolicy(
            String name,
            byte[] delimiters,
            boolean collapseCrLf,
            Byte requiredFirstByte,
            boolean skipEmptyFrames,
            boolean emitTrailingRemainder
    ) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(delimiters, "delimiters");
        if (delimiters.length == 0) throw new IllegalArgumentException("at least one delimiter required");
        this.delimiters = delimiters.clone();
        this.collapseCrLf = collapseCrLf;
        this.requiredFirstByte = requiredFirstByte;
        this.skipEmptyFrames = skipEmptyFrames;
        this.emitTrailingRemainder = emitTrailingRemainder;
    }

    public static FramingPolicy lines() {
        return LINES;
    }

    public static FramingPolicy serverSentEventLines() {
        return SSE_LINES;
    }

    public static FramingPolicy jsonSequence() {
        return JSON_SEQUENCE;
    }

    public String name() {
        return name;
    }

    byte[] delimiters() {
        return delimiters;
    }

    public boolean collapseCrLf() {
        return collapseCrLf;
    }

    public boolean hasRequiredFirstByte() {
        return requiredFirstByte != null;
    }

    public byte requiredFirstByte() {
        if (requiredFirstByte == null) throw new IllegalStateException(name + " has no required first byte");
        return requiredFirstByte;
    }

    public boolean skipEmptyFrames() {
        return skipEmptyFrames;
    }

    public boolean emitTrailingRemainder() {
        return emitTrailingRemainder;
    }

    @Override
    public String toString() {
        return "FramingPolicy{" + name + ", delimiters=" + Arrays.toString(delimiters) + '}';
    }
}
