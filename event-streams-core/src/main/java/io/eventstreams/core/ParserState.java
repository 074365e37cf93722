package io.eventstreams.core;

/**
 * States of the incremental decoders. Transitions only move towards {@link #FINISHED}.
 */
public enum ParserState {
    /** Nothing validated yet; used by decoders that check the first byte of the stream. */
    INITIAL,
    /** Scanning the buffer for the next delimiter. */
    WAITING_FOR_DELIMITER,
    /** A line ended with CR; a directly following LF belongs to the same terminator. */
    CONSUMED_CR,
    /** Inside the records of a JSON Text Sequence, after the leading RS was seen. */
    PARSING_RECORD,
    /** Terminal. */
    FINISHED
}
