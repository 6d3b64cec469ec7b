package dev.chatclient.sdk.protocol;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ServerSentEventReaderTest {

    private static ServerSentEventReader reader(String body) {
        return new ServerSentEventReader(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldReadEventsInOrder() throws IOException {
        ServerSentEventReader reader = reader("data: {\"a\":1}\n\ndata: [DONE]\n\n");

        assertThat(reader.readNext().getData()).isEqualTo("{\"a\":1}");
        assertThat(reader.readNext().getData()).isEqualTo("[DONE]");
        assertThat(reader.readNext()).isNull();
        assertThat(reader.readNext()).isNull();
    }

    @Test
    void shouldJoinMultiLineDataAndKeepEventFields() throws IOException {
        ServerSentEventReader reader = reader("""
                : keep-alive
                event: message
                id: 7
                retry: 1000
                data: first
                data:second

                """);

        ServerSentEvent event = reader.readNext();

        assertThat(event.getEventType()).isEqualTo("message");
        assertThat(event.getId()).isEqualTo("7");
        assertThat(event.getData()).isEqualTo("first\nsecond");
        assertThat(reader.readNext()).isNull();
    }

    @Test
    void shouldSkipEventsWithoutData() throws IOException {
        ServerSentEventReader reader = reader("event: ping\n\n: comment\n\ndata: payload\n\n");

        ServerSentEvent event = reader.readNext();

        assertThat(event.getEventType()).isNull();
        assertThat(event.getData()).isEqualTo("payload");
    }

    @Test
    void shouldDispatchTrailingEventWithoutBlankLine() throws IOException {
        ServerSentEventReader reader = reader("data: tail");

        assertThat(reader.readNext().getData()).isEqualTo("tail");
        assertThat(reader.readNext()).isNull();
    }

    @Test
    void shouldHandleCarriageReturnLineEndings() throws IOException {
        ServerSentEventReader reader = reader("data: one\r\n\r\ndata: two\r\n\r\n");

        assertThat(reader.readNext().getData()).isEqualTo("one");
        assertThat(reader.readNext().getData()).isEqualTo("two");
    }
}
