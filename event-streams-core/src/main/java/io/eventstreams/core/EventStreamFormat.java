package io.eventstreams.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Wire formats supported by {@link EventStreams} and their media types.
 */
public enum EventStreamFormat {

    /** Newline-delimited lines of arbitrary bytes. */
    LINES("text/plain"),

    /** One JSON value per LF-terminated line; {@code application/x-ndjson} is accepted as an alias. */
    JSON_LINES("application/jsonl", "application/x-ndjson", "application/x-jsonlines"),

    /** RFC 7464 JSON Text Sequences: {@code <RS>json<LF>} per record. */
    JSON_SEQUENCE("application/json-seq"),

    /** WHATWG Server-Sent Events. */
    SERVER_SENT_EVENTS("text/event-stream");

    private final String contentType;
    private final List<String> aliases;

    EventStreamFormat(String contentType, String... aliases) {
        this.contentType = contentType;
        this.aliases = List.of(aliases);
    }

    /**
     * Returns the HTTP Content-Type header value for this format.
     */
    public String contentType() {
        return contentType;
    }

    /**
     * Other media types that resolve to this format.
     */
    public List<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a {@code Content-Type} header value, ignoring parameters and case.
     */
    public static Optional<EventStreamFormat> fromContentType(String contentType) {
        if (contentType == null) return Optional.empty();
        int semi = contentType.indexOf(';');
        String base = (semi >= 0 ? contentType.substring(0, semi) : contentType).trim().toLowerCase(Locale.ROOT);
        for (EventStreamFormat f : values()) {
            if (f.contentType.equals(base) || f.aliases.contains(base)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
