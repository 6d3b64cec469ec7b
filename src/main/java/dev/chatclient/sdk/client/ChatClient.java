package dev.chatclient.sdk.client;

import dev.chatclient.sdk.cancellation.CallContext;
import dev.chatclient.sdk.instrumentation.TelemetrySettings;
import dev.chatclient.sdk.instrumentation.TelemetrySource;
import dev.chatclient.sdk.internal.CompletionRunner;
import dev.chatclient.sdk.protocol.ChatMessageParser;
import dev.chatclient.sdk.protocol.ChatRequestSerializer;
import dev.chatclient.sdk.transport.ChatTransport;
import dev.chatclient.sdk.transport.HttpChatTransport;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatRequest;
import dev.chatclient.sdk.types.options.ChatClientOptions;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;

/**
 * Client for a chat completions service.
 *
 * Example:
 * <pre>{@code
 * ChatClientOptions options = ChatClientOptions.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("gpt-4o-mini")
 *     .build();
 *
 * try (ChatClient client = new ChatClient(options)) {
 *     ChatCompletion completion = client.completeChat(ChatRequest.of(ChatMessage.user("Hi")));
 *     log.info("{}", completion.getText());
 * }
 * }</pre>
 */
public class ChatClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ChatClient.class);

    private final ChatTransport transport;
    private final CompletionRunner runner;

    public ChatClient(ChatClientOptions options) {
        this.transport = options.getTransport() != null
                ? options.getTransport()
                : new HttpChatTransport(options);

        OpenTelemetry openTelemetry = options.getOpenTelemetry() != null
                ? options.getOpenTelemetry()
                : GlobalOpenTelemetry.get();
        TelemetrySource telemetry = new TelemetrySource(openTelemetry, TelemetrySettings.from(options), options.getModel());

        this.runner = new CompletionRunner(
                transport,
                new ChatRequestSerializer(),
                new ChatMessageParser(),
                telemetry,
                options.getModel());
        logger.debug("Created chat client for {}", options.getEndpoint());
    }

    public ChatCompletion completeChat(ChatRequest request) {
        return completeChat(request, CallContext.none());
    }

    /**
     * @throws dev.chatclient.sdk.exceptions.ServiceResponseException for a non-success status
     * @throws dev.chatclient.sdk.exceptions.ConnectionException if the service cannot be reached
     * @throws dev.chatclient.sdk.exceptions.OperationCancelledException if the token was cancelled
     */
    public ChatCompletion completeChat(ChatRequest request, CallContext context) {
        return runner.complete(request, context);
    }

    public StreamingChatUpdates completeChatStreaming(ChatRequest request) {
        return completeChatStreaming(request, CallContext.none());
    }

    /**
     * Starts a streaming completion. The request is sent when iteration begins.
     * Cancelling the context's token ends the call's telemetry as cancelled
     * right away and makes the next advance throw.
     */
    public StreamingChatUpdates completeChatStreaming(ChatRequest request, CallContext context) {
        return new StreamingChatUpdates(runner.stream(request, context));
    }

    @Override
    public void close() {
        transport.close();
    }
}
