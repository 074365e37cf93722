package io.eventstreams.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerSentEventsEncodingTest {

    @Test
    void multiLineDataBecomesOneDataLinePerLine() throws Exception {
        assertThat(encode(List.of(ServerSentEvent.ofData("hello\nworld"))))
                .isEqualTo("data: hello\ndata: world\n\n");
    }

    @Test
    void twoEventsAreSeparatedByBlankLines() throws Exception {
        assertThat(encode(List.of(ServerSentEvent.ofData("hello\nworld"), ServerSentEvent.ofData("hello2\nworld2"))))
                .isEqualTo("data: hello\ndata: world\n\ndata: hello2\ndata: world2\n\n");
    }

    @Test
    void fieldsAreWrittenInFixedOrder() throws Exception {
        ServerSentEvent event = ServerSentEvent.builder().data("d").retry(10).event("e").id("i").build();

        assertThat(encode(List.of(event))).isEqualTo("id: i\nevent: e\nretry: 10\ndata: d\n\n");
    }

    @Test
    void encodesScenario() throws Exception {
        assertThat(encode(ServerSentEventsDecodingTest.SCENARIO_EVENTS)).isEqualTo(ServerSentEventsDecodingTest.SCENARIO);
    }

    @Test
    void carriageReturnsInDataAreNormalised() throws Exception {
        assertThat(encode(List.of(ServerSentEvent.ofData("a\r\nb\rc\n"))))
                .isEqualTo("data: a\ndata: b\ndata: c\ndata: \n\n");
    }

    @Test
    void eventWithoutFieldsIsJustABlankLine() throws Exception {
        assertThat(encode(List.of(ServerSentEvent.builder().build()))).isEqualTo("\n");
    }

    @Test
    void roundTripsThroughDecoder() throws Exception {
        List<ServerSentEvent> events = List.of(
                ServerSentEvent.builder().id("1").event("update").data("{\"a\":1}").build(),
                ServerSentEvent.ofData("multi\nline\n\npayload"),
                ServerSentEvent.builder().retry(250).data("").build());

        byte[] wire = ByteChunks.readAllBytes(EventStreams.encodeServerSentEvents(EventReader.of(events)));

        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.oneBytePerChunk(wire)).readAll()).isEqualTo(events);
    }

    @Test
    void serializerRejectsItemsAfterFinishing() {
        ServerSentEventsSerializer serializer = new ServerSentEventsSerializer();
        assertThat(serializer.ingest(null)).isNull();
        assertThat(serializer.isFinished()).isTrue();

        assertThatThrownBy(() -> serializer.ingest(ServerSentEvent.ofData("late")))
                .isInstanceOf(IllegalStateException.class);
    }

    private static String encode(List<ServerSentEvent> events) throws Exception {
        return new String(ByteChunks.readAllBytes(EventStreams.encodeServerSentEvents(EventReader.of(events))),
                StandardCharsets.UTF_8);
    }
}
