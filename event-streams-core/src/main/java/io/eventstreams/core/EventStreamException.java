package io.eventstreams.core;

/**
 * Base class for structural event stream failures.
 *
 * <p>A structural failure is fatal for the sequence that raised it: the reader that detected it
 * throws once and produces nothing afterwards. Payload codec failures are not modelled here, they
 * propagate as the codec's own exception.
 */
public abstract class EventStreamException extends RuntimeException {

    protected EventStreamException(String message) {
        super(message);
    }

    protected EventStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the first byte of a JSON Text Sequence is not {@code <RS>}.
     */
    public static class MissingInitialRecordSeparator extends EventStreamException {
        public MissingInitialRecordSeparator(String message) {
            super(message);
        }
    }
}
