package dev.chatclient.sdk.internal;

import dev.chatclient.sdk.cancellation.CallContext;
import dev.chatclient.sdk.exceptions.ServiceResponseException;
import dev.chatclient.sdk.instrumentation.InstrumentationScope;
import dev.chatclient.sdk.instrumentation.StreamingScope;
import dev.chatclient.sdk.instrumentation.TelemetrySource;
import dev.chatclient.sdk.protocol.ChatMessageParser;
import dev.chatclient.sdk.protocol.ChatRequestSerializer;
import dev.chatclient.sdk.transport.ChatTransport;
import dev.chatclient.sdk.transport.RawResponse;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * Runs chat completion calls against a {@link ChatTransport} and reports them
 * to a {@link TelemetrySource}.
 */
public class CompletionRunner {

    private static final Logger logger = LoggerFactory.getLogger(CompletionRunner.class);

    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final ChatTransport transport;
    private final ChatRequestSerializer serializer;
    private final ChatMessageParser parser;
    private final TelemetrySource telemetry;
    @Nullable
    private final String defaultModel;

    public CompletionRunner(ChatTransport transport,
                            ChatRequestSerializer serializer,
                            ChatMessageParser parser,
                            TelemetrySource telemetry,
                            @Nullable String defaultModel) {
        this.transport = transport;
        this.serializer = serializer;
        this.parser = parser;
        this.telemetry = telemetry;
        this.defaultModel = defaultModel;
    }

    /**
     * Unary completion. The body is buffered before it is decoded.
     */
    public ChatCompletion complete(ChatRequest request, CallContext context) {
        try (RawResponse response = execute(request, false, context)) {
            return parser.parseCompletion(response.getContentAsString());
        }
    }

    /**
     * Prepares a streaming completion. Nothing is sent until the returned
     * iterator is first advanced.
     */
    public StreamingChatUpdateIterator stream(ChatRequest request, CallContext context) {
        InstrumentationScope instrumentation = telemetry.startStreamingChatScope(request, context);
        StreamingScope scope = new StreamingScope(instrumentation);
        CallContext innerContext = context.withInstrumentationActive();
        return new StreamingChatUpdateIterator(
                () -> execute(request, true, innerContext),
                parser,
                scope,
                context.getCancellationToken());
    }

    /**
     * Sends the request and checks the status. Unary bodies are buffered and,
     * unless the context is already instrumented, reported before returning.
     *
     * @throws ServiceResponseException for a non-success status
     */
    RawResponse execute(ChatRequest request, boolean streaming, CallContext context) {
        InstrumentationScope scope = telemetry.startChatScope(request, context);
        RawResponse response = null;
        try {
            String body = serializer.serialize(request, defaultModel, streaming);
            response = transport.send(CHAT_COMPLETIONS_PATH, body, streaming, context.getCancellationToken());
            if (!response.isSuccessStatus()) {
                String errorBody = response.getContentAsString();
                logger.debug("Chat completion failed with status {}", response.getStatus());
                throw new ServiceResponseException(response.getStatus(), errorBody);
            }
            if (!streaming) {
                response.bufferContent();
                if (scope != null) {
                    scope.recordChatCompletion(parser.parseCompletion(response.getContentAsString()));
                }
            }
            return response;
        } catch (RuntimeException e) {
            if (response != null) {
                response.close();
            }
            if (scope != null) {
                scope.recordException(e);
            }
            throw e;
        } finally {
            if (scope != null) {
                scope.close();
            }
        }
    }
}
