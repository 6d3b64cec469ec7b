package dev.chatclient.sdk.transport;

import dev.chatclient.sdk.support.TrackingInputStream;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;

class RawResponseTest {

    @Test
    void shouldBufferBodyAndReleaseStream() throws IOException {
        TrackingInputStream body = new TrackingInputStream("payload");
        RawResponse response = new RawResponse(200, body);

        response.bufferContent();

        assertThat(body.isClosed()).isTrue();
        try (InputStream first = response.getContentStream(); InputStream second = response.getContentStream()) {
            assertThat(first.readAllBytes()).isEqualTo(second.readAllBytes());
        }
        assertThat(response.getContentAsString()).isEqualTo("payload");
    }

    @Test
    void shouldTreatMissingBodyAsEmpty() {
        RawResponse response = new RawResponse(204, null);

        assertThat(response.getContentStream()).isNull();
        assertThat(response.getContentAsString()).isEmpty();
        assertThat(response.isSuccessStatus()).isTrue();
    }

    @Test
    void shouldCloseOnlyOnce() {
        TrackingInputStream body = new TrackingInputStream("x");
        RawResponse response = new RawResponse(500, body);

        response.close();
        response.close();

        assertThat(response.isClosed()).isTrue();
        assertThat(body.isClosed()).isTrue();
        assertThat(response.isSuccessStatus()).isFalse();
    }
}
