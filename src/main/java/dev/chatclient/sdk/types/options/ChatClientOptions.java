package dev.chatclient.sdk.types.options;

import dev.chatclient.sdk.transport.ChatTransport;
import io.opentelemetry.api.OpenTelemetry;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration options for {@link dev.chatclient.sdk.client.ChatClient}.
 * Use {@link #builder()} to create instances.
 */
@Getter
@Builder(toBuilder = true)
public class ChatClientOptions {

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.openai.com/v1");

    @Builder.Default
    private final URI endpoint = DEFAULT_ENDPOINT;

    @Nullable
    private final String apiKey;

    /**
     * Model used when a request does not name one.
     */
    private final String model;

    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(60);

    @Singular("header")
    private final Map<String, String> headers;

    /**
     * Telemetry sink. Falls back to {@code GlobalOpenTelemetry.get()}.
     */
    @Nullable
    private final OpenTelemetry openTelemetry;

    /**
     * Emit per-message and per-choice span events. When null the
     * {@code chatclient.experimental.recordEvents} system property and the
     * {@code CHATCLIENT_EXPERIMENTAL_RECORD_EVENTS} environment variable decide.
     */
    @Nullable
    private final Boolean recordEvents;

    /**
     * Include message text and tool arguments in events instead of a
     * placeholder. When null the {@code chatclient.experimental.recordContent}
     * system property and the {@code CHATCLIENT_EXPERIMENTAL_RECORD_CONTENT}
     * environment variable decide.
     */
    @Nullable
    private final Boolean recordContent;

    /**
     * Custom transport. When null an HTTP transport is created from the endpoint.
     */
    @Nullable
    private final ChatTransport transport;
}
