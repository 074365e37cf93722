package io.eventstreams.core;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * A {@link ServerSentEvent} whose data field carries a JSON value.
 *
 * @param event type of the event
 * @param data decoded payload
 * @param id unique identifier of the event
 * @param retry reconnection delay in milliseconds
 * @param <T> payload type
 */
public record ServerSentEventWithJsonData<T>(
        Optional<String> event,
        Optional<T> data,
        Optional<String> id,
        OptionalLong retry
) {
    public ServerSentEventWithJsonData {
        event = (event == null) ? Optional.empty() : event;
        data = (data == null) ? Optional.empty() : data;
        id = (id == null) ? Optional.empty() : id;
        retry = (retry == null) ? OptionalLong.empty() : retry;
    }

    public static <T> ServerSentEventWithJsonData<T> of(String event, T data, String id) {
        return new ServerSentEventWithJsonData<>(
                Optional.ofNullable(event), Optional.ofNullable(data), Optional.ofNullable(id), OptionalLong.empty());
    }

    public static <T> ServerSentEventWithJsonData<T> ofData(T data) {
        return of(null, data, null);
    }

    public ServerSentEventWithJsonData<T> withRetry(long retry) {
        return new ServerSentEventWithJsonData<>(event, data, id, OptionalLong.of(retry));
    }
}
