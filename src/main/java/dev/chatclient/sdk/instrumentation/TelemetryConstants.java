package dev.chatclient.sdk.instrumentation;

import io.opentelemetry.api.common.AttributeKey;

import java.util.List;

/**
 * Attribute, metric and event names reported by the client.
 */
public final class TelemetryConstants {

    public static final String INSTRUMENTATION_SCOPE = "dev.chatclient.sdk";

    public static final String SYSTEM_NAME = "openai";

    public static final String OPERATION_CHAT = "chat";
    public static final String OPERATION_EMBEDDING = "embedding";

    public static final AttributeKey<String> OPERATION_NAME = AttributeKey.stringKey("gen_ai.operation.name");
    public static final AttributeKey<String> SYSTEM = AttributeKey.stringKey("gen_ai.system");
    public static final AttributeKey<String> REQUEST_MODEL = AttributeKey.stringKey("gen_ai.request.model");
    public static final AttributeKey<String> SERVER_ADDRESS = AttributeKey.stringKey("server.address");
    public static final AttributeKey<Long> SERVER_PORT = AttributeKey.longKey("server.port");
    public static final AttributeKey<Long> REQUEST_MAX_TOKENS = AttributeKey.longKey("gen_ai.request.max_tokens");
    public static final AttributeKey<Double> REQUEST_TEMPERATURE = AttributeKey.doubleKey("gen_ai.request.temperature");
    public static final AttributeKey<Double> REQUEST_TOP_P = AttributeKey.doubleKey("gen_ai.request.top_p");
    public static final AttributeKey<String> RESPONSE_ID = AttributeKey.stringKey("gen_ai.response.id");
    public static final AttributeKey<String> RESPONSE_MODEL = AttributeKey.stringKey("gen_ai.response.model");
    public static final AttributeKey<List<String>> RESPONSE_FINISH_REASONS =
            AttributeKey.stringArrayKey("gen_ai.response.finish_reasons");
    public static final AttributeKey<Long> USAGE_INPUT_TOKENS = AttributeKey.longKey("gen_ai.usage.input_tokens");
    public static final AttributeKey<Long> USAGE_OUTPUT_TOKENS = AttributeKey.longKey("gen_ai.usage.output_tokens");
    public static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");
    public static final AttributeKey<String> TOKEN_TYPE = AttributeKey.stringKey("gen_ai.token.type");
    public static final AttributeKey<String> EVENT_DATA = AttributeKey.stringKey("event.data");

    public static final String TOKEN_TYPE_INPUT = "input";
    public static final String TOKEN_TYPE_OUTPUT = "output";

    public static final String METRIC_OPERATION_DURATION = "gen_ai.client.operation.duration";
    public static final String METRIC_TOKEN_USAGE = "gen_ai.client.token.usage";
    public static final String METRIC_STREAMS_STARTED = "gen_ai.client.streams.started";
    public static final String METRIC_STREAMS_COMPLETED = "gen_ai.client.streams.completed";

    public static final String EVENT_CHOICE = "gen_ai.choice";

    /**
     * Placeholder written instead of message text when content recording is off.
     */
    public static final String REDACTED = "REDACTED";

    /**
     * Classification of a chat call that ended without a finish reason or exception.
     */
    public static final String GENERIC_ERROR = "error";

    private TelemetryConstants() {
    }

    /**
     * @return {@code gen_ai.<role>.message}
     */
    public static String messageEventName(String role) {
        return "gen_ai." + role + ".message";
    }
}
