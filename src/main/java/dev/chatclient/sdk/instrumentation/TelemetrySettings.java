package dev.chatclient.sdk.instrumentation;

import dev.chatclient.sdk.types.options.ChatClientOptions;
import lombok.Getter;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.function.Function;

/**
 * Resolved telemetry configuration for one client.
 *
 * <p>Each recording switch is taken from the options when set, then from a
 * system property, then from an environment variable ({@code true} or
 * {@code 1}), and is off otherwise.
 */
@Getter
public final class TelemetrySettings {

    public static final String RECORD_EVENTS_PROPERTY = "chatclient.experimental.recordEvents";
    public static final String RECORD_CONTENT_PROPERTY = "chatclient.experimental.recordContent";
    public static final String RECORD_EVENTS_ENV = "CHATCLIENT_EXPERIMENTAL_RECORD_EVENTS";
    public static final String RECORD_CONTENT_ENV = "CHATCLIENT_EXPERIMENTAL_RECORD_CONTENT";

    private final boolean recordEvents;
    private final boolean recordContent;
    @Nullable
    private final String serverAddress;
    private final int serverPort;

    public TelemetrySettings(boolean recordEvents, boolean recordContent, @Nullable String serverAddress, int serverPort) {
        this.recordEvents = recordEvents;
        this.recordContent = recordContent;
        this.serverAddress = serverAddress;
        this.serverPort = serverPort;
    }

    public static TelemetrySettings from(ChatClientOptions options) {
        return from(options, System::getProperty, System::getenv);
    }

    static TelemetrySettings from(ChatClientOptions options,
                                  Function<String, String> properties,
                                  Function<String, String> environment) {
        boolean recordEvents = resolve(options.getRecordEvents(), RECORD_EVENTS_PROPERTY, RECORD_EVENTS_ENV,
                properties, environment);
        boolean recordContent = resolve(options.getRecordContent(), RECORD_CONTENT_PROPERTY, RECORD_CONTENT_ENV,
                properties, environment);

        URI endpoint = options.getEndpoint();
        return new TelemetrySettings(recordEvents, recordContent, endpoint.getHost(), port(endpoint));
    }

    private static boolean resolve(@Nullable Boolean explicit, String property, String variable,
                                   Function<String, String> properties, Function<String, String> environment) {
        if (explicit != null) {
            return explicit;
        }
        String value = properties.apply(property);
        if (value == null) {
            value = environment.apply(variable);
        }
        return isEnabled(value);
    }

    static boolean isEnabled(@Nullable String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return "1".equals(trimmed) || "true".equalsIgnoreCase(trimmed);
    }

    private static int port(URI endpoint) {
        if (endpoint.getPort() != -1) {
            return endpoint.getPort();
        }
        return "http".equalsIgnoreCase(endpoint.getScheme()) ? 80 : 443;
    }
}
