package io.eventstreams.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamFormatTest {

    @Test
    void resolvesContentTypeIgnoringParametersAndCase() {
        assertThat(EventStreamFormat.fromContentType("text/event-stream; charset=utf-8"))
                .contains(EventStreamFormat.SERVER_SENT_EVENTS);
        assertThat(EventStreamFormat.fromContentType("Application/JSON-SEQ"))
                .contains(EventStreamFormat.JSON_SEQUENCE);
        assertThat(EventStreamFormat.fromContentType("application/jsonl")).contains(EventStreamFormat.JSON_LINES);
        assertThat(EventStreamFormat.fromContentType("text/plain; charset=utf-8")).contains(EventStreamFormat.LINES);
    }

    @Test
    void ndjsonIsAnAliasOfJsonLines() {
        assertThat(EventStreamFormat.fromContentType("application/x-ndjson")).contains(EventStreamFormat.JSON_LINES);
        assertThat(EventStreamFormat.fromContentType("Application/X-NDJSON; charset=utf-8"))
                .contains(EventStreamFormat.JSON_LINES);
        assertThat(EventStreamFormat.JSON_LINES.contentType()).isEqualTo("application/jsonl");
        assertThat(EventStreamFormat.LINES.aliases()).isEmpty();
    }

    @Test
    void unknownOrMissingContentTypeIsEmpty() {
        assertThat(EventStreamFormat.fromContentType("application/json")).isEmpty();
        assertThat(EventStreamFormat.fromContentType(null)).isEmpty();
    }
}
