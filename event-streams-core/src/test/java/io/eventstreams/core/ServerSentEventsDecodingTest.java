package io.eventstreams.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.eventstreams.core.LinesDecodingTest.lines;
import static org.assertj.core.api.Assertions.assertThat;

class ServerSentEventsDecodingTest {

    static final String SCENARIO = "retry: 5000\n"
            + "\n"
            + "data: This is the first message.\n"
            + "\n"
            + "data: This is the second\n"
            + "data: message.\n"
            + "\n"
            + "event: customEvent\n"
            + "data: This is a custom event message.\n"
            + "\n"
            + "id: 123\n"
            + "data: This is a message with an ID.\n"
            + "\n";

    static final List<ServerSentEvent> SCENARIO_EVENTS = List.of(
            ServerSentEvent.builder().retry(5000).build(),
            ServerSentEvent.ofData("This is the first message."),
            ServerSentEvent.ofData("This is the second\nmessage."),
            ServerSentEvent.builder().event("customEvent").data("This is a custom event message.").build(),
            ServerSentEvent.builder().id("123").data("This is a message with an ID.").build());

    @Test
    void lineEndingsAreEquivalent() throws Exception {
        for (String input : List.of("hello\nworld\n", "hello\rworld\r", "hello\r\nworld\r\n")) {
            assertThat(lines(EventStreams.decodeServerSentEventLines(ByteChunks.oneBytePerChunk(utf8(input)))))
                    .as("%s", input.replace("\r", "\\r").replace("\n", "\\n"))
                    .containsExactly("hello", "world");
        }
    }

    @Test
    void crLfSplitAcrossChunksCountsOnce() throws Exception {
        EventReader<byte[]> chunks = ByteChunks.of(utf8("a\r"), utf8("\nb\r"), utf8("\r\n"));

        assertThat(lines(EventStreams.decodeServerSentEventLines(chunks))).containsExactly("a", "b", "");
    }

    @Test
    void decodesScenarioOneBytePerChunk() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.oneBytePerChunk(utf8(SCENARIO))).readAll())
                .isEqualTo(SCENARIO_EVENTS);
    }

    @Test
    void decodesScenarioWithCarriageReturns() throws Exception {
        String crlf = SCENARIO.replace("\n", "\r\n");

        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.oneBytePerChunk(utf8(crlf))).readAll())
                .isEqualTo(SCENARIO_EVENTS);
    }

    @Test
    void multiLineDataIsJoinedWithoutTrailingNewline() throws Exception {
        List<ServerSentEvent> events = EventStreams.decodeServerSentEvents(
                ByteChunks.ofUtf8("data: line1\ndata: line2\n\n")).readAll();

        assertThat(events).hasSize(1);
        assertThat(events.get(0).data()).contains("line1\nline2");
    }

    @Test
    void incompleteTrailingEventIsDiscarded() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8("data: hello")).readAll()).isEmpty();
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8("data: a\n\ndata: b\n")).readAll())
                .containsExactly(ServerSentEvent.ofData("a"));
    }

    @Test
    void commentsAndUnknownFieldsAreIgnored() throws Exception {
        String input = ": keep-alive\nfoo: bar\ndata: x\nnocolon\n\n";

        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8(input)).readAll())
                .containsExactly(ServerSentEvent.ofData("x"));
    }

    @Test
    void onlyOneLeadingSpaceIsStripped() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8("data:  two\ndata:none\n\n")).readAll())
                .containsExactly(ServerSentEvent.ofData(" two\nnone"));
    }

    @Test
    void unparsableRetryIsSkipped() throws Exception {
        List<ServerSentEvent> events = EventStreams.decodeServerSentEvents(
                ByteChunks.ofUtf8("retry: soon\ndata: x\n\nretry: 10\nretry: 1x\n\n")).readAll();

        assertThat(events).containsExactly(
                ServerSentEvent.ofData("x"),
                ServerSentEvent.builder().retry(10).build());
    }

    @Test
    void laterFieldsOverwriteEarlierOnes() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8("id: 1\nid: 2\nevent: a\nevent: b\n\n")).readAll())
                .containsExactly(ServerSentEvent.builder().id("2").event("b").build());
    }

    @Test
    void emptyDataFieldYieldsEmptyString() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.ofUtf8("data:\n\n")).readAll())
                .containsExactly(ServerSentEvent.ofData(""));
    }

    @Test
    void sentinelEndsTheStreamWithoutEmittingIt() throws Exception {
        String input = "data: one\n\ndata: [DONE]\n\ndata: never\n\n";

        List<ServerSentEvent> events = EventStreams.decodeServerSentEvents(
                ByteChunks.oneBytePerChunk(utf8(input)), data -> !data.equals("[DONE]")).readAll();

        assertThat(events).containsExactly(ServerSentEvent.ofData("one"));
    }

    @Test
    void sentinelIsNotConsultedForEventsWithoutData() throws Exception {
        List<ServerSentEvent> events = EventStreams.decodeServerSentEvents(
                ByteChunks.ofUtf8("event: ping\n\ndata: x\n\n"), data -> false).readAll();

        assertThat(events).containsExactly(ServerSentEvent.builder().event("ping").build());
    }

    @Test
    void multiByteCharactersSurviveOneBytePerChunk() throws Exception {
        assertThat(EventStreams.decodeServerSentEvents(ByteChunks.oneBytePerChunk(utf8("data: h\u00e9llo \u2603\n\n"))).readAll())
                .containsExactly(ServerSentEvent.ofData("h\u00e9llo \u2603"));
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
