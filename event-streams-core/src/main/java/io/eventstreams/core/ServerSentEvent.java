package io.eventstreams.core;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * An event sent by the server.
 *
 * <p>See <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#event-stream-interpretation">
 * event stream interpretation</a>.
 *
 * @param id unique identifier of the event, usable as {@code Last-Event-ID} when resuming
 * @param event type of the event, tells the client how to interpret the data
 * @param data payload; lines of a multi-line payload are joined with LF
 * @param retry reconnection delay in milliseconds
 */
public record ServerSentEvent(
        Optional<String> id,
        Optional<String> event,
        Optional<String> data,
        OptionalLong retry
) {
    public ServerSentEvent {
        id = (id == null) ? Optional.empty() : id;
        event = (event == null) ? Optional.empty() : event;
        data = (data == null) ? Optional.empty() : data;
        retry = (retry == null) ? OptionalLong.empty() : retry;
    }

    public static ServerSentEvent ofData(String data) {
        return builder().data(data).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id.orElse(null);
        b.event = event.orElse(null);
        b.data = data.orElse(null);
        b.retry = retry.isPresent() ? retry.getAsLong() : null;
        return b;
    }

    /**
     * Builder for {@link ServerSentEvent}; every field is optional.
     */
    public static final class Builder {
        private String id;
        private String event;
        private String data;
        private Long retry;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder data(String data) {
            this.data = data;
            return this;
        }

        public Builder retry(long retry) {
            this.retry = retry;
            return this;
        }

        public ServerSentEvent build() {
            return new ServerSentEvent(
                    Optional.ofNullable(id),
                    Optional.ofNullable(event),
                    Optional.ofNullable(data),
                    retry == null ? OptionalLong.empty() : OptionalLong.of(retry));
        }
    }
}
