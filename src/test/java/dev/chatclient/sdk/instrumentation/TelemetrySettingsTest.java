package dev.chatclient.sdk.instrumentation;

import dev.chatclient.sdk.types.options.ChatClientOptions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetrySettingsTest {

    private static final Map<String, String> NONE = Map.of();

    @Test
    void shouldBeOffByDefault() {
        TelemetrySettings settings = TelemetrySettings.from(ChatClientOptions.builder().build(), NONE::get, NONE::get);

        assertThat(settings.isRecordEvents()).isFalse();
        assertThat(settings.isRecordContent()).isFalse();
        assertThat(settings.getServerAddress()).isEqualTo("api.openai.com");
        assertThat(settings.getServerPort()).isEqualTo(443);
    }

    @Test
    void shouldPreferExplicitValueOverPropertyAndEnvironment() {
        Map<String, String> properties = Map.of(TelemetrySettings.RECORD_EVENTS_PROPERTY, "true");
        Map<String, String> environment = Map.of(TelemetrySettings.RECORD_CONTENT_ENV, "1");
        ChatClientOptions options = ChatClientOptions.builder().recordEvents(false).build();

        TelemetrySettings settings = TelemetrySettings.from(options, properties::get, environment::get);

        assertThat(settings.isRecordEvents()).isFalse();
        assertThat(settings.isRecordContent()).isTrue();
    }

    @Test
    void shouldPreferPropertyOverEnvironment() {
        Map<String, String> properties = Map.of(TelemetrySettings.RECORD_EVENTS_PROPERTY, "false");
        Map<String, String> environment = Map.of(TelemetrySettings.RECORD_EVENTS_ENV, "TRUE");

        TelemetrySettings settings = TelemetrySettings.from(ChatClientOptions.builder().build(), properties::get, environment::get);

        assertThat(settings.isRecordEvents()).isFalse();
    }

    @Test
    void shouldAcceptOnlyTrueOrOne() {
        assertThat(TelemetrySettings.isEnabled("True")).isTrue();
        assertThat(TelemetrySettings.isEnabled(" 1 ")).isTrue();
        assertThat(TelemetrySettings.isEnabled("yes")).isFalse();
        assertThat(TelemetrySettings.isEnabled(null)).isFalse();
    }

    @Test
    void shouldTakeServerFromEndpoint() {
        ChatClientOptions plain = ChatClientOptions.builder().endpoint(URI.create("http://localhost/v1")).build();
        ChatClientOptions explicitPort = ChatClientOptions.builder().endpoint(URI.create("https://llm.internal:8443/v1")).build();

        assertThat(TelemetrySettings.from(plain, NONE::get, NONE::get).getServerPort()).isEqualTo(80);
        TelemetrySettings settings = TelemetrySettings.from(explicitPort, NONE::get, NONE::get);
        assertThat(settings.getServerAddress()).isEqualTo("llm.internal");
        assertThat(settings.getServerPort()).isEqualTo(8443);
    }
}
