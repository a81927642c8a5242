package io.agentloom.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SseFrameParserTest {

    private final SseFrameParser parser = new SseFrameParser();

    @Test
    void shouldAssembleFrameAcrossChunks() {
        assertThat(parser.feed("event: endp")).isEmpty();
        assertThat(parser.feed("oint\ndata: /message?sessionId=1\n")).isEmpty();
        assertThat(parser.hasPartialFrame()).isTrue();

        List<SseFrame> frames = parser.feed("\n");

        assertThat(frames).containsExactly(new SseFrame(null, "endpoint", "/message?sessionId=1", Map.of()));
        assertThat(parser.hasPartialFrame()).isFalse();
    }

    @Test
    void shouldJoinDataLinesAndDefaultEventType() {
        List<SseFrame> frames = parser.feed("id: 4\ndata: {\"a\":\ndata: 1}\n\n");

        assertThat(frames).singleElement().satisfies(frame -> {
            assertThat(frame.id()).isEqualTo("4");
            assertThat(frame.event()).isEqualTo("message");
            assertThat(frame.data()).isEqualTo("{\"a\":\n1}");
        });
    }

    @Test
    void shouldAcceptAllLineEndings() {
        List<SseFrame> frames = parser.feed("data: one\r\n\r\ndata: two\r\rdata: three\n\n");

        assertThat(frames).extracting(SseFrame::data).containsExactly("one", "two", "three");
    }

    @Test
    void shouldSplitCarriageReturnLineFeedAcrossChunks() {
        assertThat(parser.feed("data: one\r")).isEmpty();

        assertThat(parser.feed("\n\r\n")).extracting(SseFrame::data).containsExactly("one");
    }

    @Test
    void shouldSkipCommentsAndKeepUnknownFields() {
        List<SseFrame> frames = parser.feed(": keep-alive\n\nretry: 3000\ndata: x\n\n");

        assertThat(frames).singleElement().satisfies(frame -> {
            assertThat(frame.data()).isEqualTo("x");
            assertThat(frame.fields()).containsEntry("retry", "3000");
        });
    }
}
