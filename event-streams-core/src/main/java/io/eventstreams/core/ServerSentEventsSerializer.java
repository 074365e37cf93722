package io.eventstreams.core;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Writes {@link ServerSentEvent}s in the {@code text/event-stream} format.
 *
 * <p>Per event: {@code id}, {@code event} and {@code retry} lines when present, one {@code data}
 * line per line of the payload (split on CRLF, CR or LF), then a blank line.
 */
public final class ServerSentEventsSerializer extends AbstractEventSerializer<ServerSentEvent> {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    @Override
    protected byte[] encode(ServerSentEvent event) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        event.id().ifPresent(v -> field(out, "id", v));
        event.event().ifPresent(v -> field(out, "event", v));
        if (event.retry().isPresent()) {
            field(out, "retry", Long.toString(event.retry().getAsLong()));
        }
        if (event.data().isPresent()) {
            for (String line : LINE_BREAK.split(event.data().get(), -1)) {
                field(out, "data", line);
            }
        }
        out.write(Ascii.LF);
        return out.toByteArray();
    }

    private static void field(ByteArrayOutputStream out, String name, String value) {
        out.writeBytes(name.getBytes(StandardCharsets.UTF_8));
        out.write(Ascii.COLON);
        out.write(Ascii.SPACE);
        out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        out.write(Ascii.LF);
    }
}
