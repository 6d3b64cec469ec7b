package dev.chatclient.sdk.instrumentation;

import dev.chatclient.sdk.exceptions.ServiceResponseException;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatFinishReason;
import dev.chatclient.sdk.types.chat.ChatMessageContentPart;
import dev.chatclient.sdk.types.chat.ChatMessageRole;
import dev.chatclient.sdk.types.chat.ChatTokenUsage;
import dev.chatclient.sdk.types.chat.ChatToolCall;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Span plus metric recording for one call.
 *
 * <p>The first {@code record*} call reports the outcome; later ones are
 * ignored. {@link #close()} ends the span and may be called any number of
 * times. Failures of the telemetry sink are logged and never thrown.
 */
public class InstrumentationScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentationScope.class);

    private final TelemetrySource source;
    private final String operation;
    private final Attributes commonAttributes;
    private final Span span;
    private final boolean streaming;
    private final long startNanos;
    private final AtomicBoolean recorded = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InstrumentationScope(TelemetrySource source, String operation, Attributes commonAttributes,
                         Span span, boolean streaming) {
        this.source = source;
        this.operation = operation;
        this.commonAttributes = commonAttributes;
        this.span = span;
        this.streaming = streaming;
        this.startNanos = System.nanoTime();
    }

    public void recordChatCompletion(ChatCompletion completion) {
        report(completion.getId(), completion.getModel(), completion.getFinishReason(), completion.getUsage(),
                completion.getRole(), completion.getContent(), completion.getToolCalls(), null, null, true);
    }

    /**
     * Reports the aggregate of a stream, whatever ended it.
     *
     * @param error     the failure that ended the stream, or null
     * @param cancelled whether the call was cancelled
     */
    public void recordStreamingChatCompletion(@Nullable String responseId,
                                              @Nullable String responseModel,
                                              @Nullable ChatMessageRole role,
                                              @Nullable ChatFinishReason finishReason,
                                              @Nullable ChatTokenUsage usage,
                                              ChatMessageContentPart content,
                                              List<ChatToolCall> toolCalls,
                                              @Nullable Throwable error,
                                              boolean cancelled) {
        String errorType = null;
        if (cancelled) {
            errorType = CancellationException.class.getName();
        } else if (error != null) {
            errorType = classify(error);
        }
        report(responseId, responseModel, finishReason, usage, role,
                Collections.singletonList(content), toolCalls, errorType, error, true);
    }

    public void recordEmbeddings(@Nullable String responseModel, @Nullable Integer inputTokens) {
        if (!recorded.compareAndSet(false, true)) {
            return;
        }
        try {
            Attributes metricAttributes = metricAttributes(responseModel, null);
            recordDuration(metricAttributes);
            if (inputTokens != null) {
                source.getTokenUsage().record(inputTokens, tokenAttributes(metricAttributes, TelemetryConstants.TOKEN_TYPE_INPUT));
                span.setAttribute(TelemetryConstants.USAGE_INPUT_TOKENS, (long) inputTokens);
            }
            if (responseModel != null) {
                span.setAttribute(TelemetryConstants.RESPONSE_MODEL, responseModel);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to record {} telemetry", operation, e);
        }
    }

    public void recordException(Throwable error) {
        report(null, null, null, null, null, Collections.emptyList(), Collections.emptyList(),
                classify(error), error, false);
    }

    public void recordCancellation() {
        report(null, null, null, null, null, Collections.emptyList(), Collections.emptyList(),
                CancellationException.class.getName(), null, false);
    }

    public boolean isRecorded() {
        return recorded.get();
    }

    /**
     * Error classification reported as {@code error.type}.
     */
    public static String classify(Throwable error) {
        if (error instanceof CancellationException) {
            return CancellationException.class.getName();
        }
        if (error instanceof ServiceResponseException) {
            return String.valueOf(((ServiceResponseException) error).getStatus());
        }
        return error.getClass().getName();
    }

    private void report(@Nullable String responseId,
                        @Nullable String responseModel,
                        @Nullable ChatFinishReason finishReason,
                        @Nullable ChatTokenUsage usage,
                        @Nullable ChatMessageRole role,
                        List<ChatMessageContentPart> content,
                        List<ChatToolCall> toolCalls,
                        @Nullable String errorType,
                        @Nullable Throwable error,
                        boolean hasResponse) {
        if (!recorded.compareAndSet(false, true)) {
            return;
        }
        if (finishReason == null && errorType == null) {
            errorType = TelemetryConstants.GENERIC_ERROR;
        }

        try {
            Attributes metricAttributes = metricAttributes(responseModel, errorType);
            recordDuration(metricAttributes);
            if (usage != null) {
                source.getTokenUsage().record(usage.getInputTokenCount(),
                        tokenAttributes(metricAttributes, TelemetryConstants.TOKEN_TYPE_INPUT));
                source.getTokenUsage().record(usage.getOutputTokenCount(),
                        tokenAttributes(metricAttributes, TelemetryConstants.TOKEN_TYPE_OUTPUT));
            }
            if (streaming) {
                source.getStreamsCompleted().add(1, commonAttributes);
            }

            if (responseId != null) {
                span.setAttribute(TelemetryConstants.RESPONSE_ID, responseId);
            }
            if (responseModel != null) {
                span.setAttribute(TelemetryConstants.RESPONSE_MODEL, responseModel);
            }
            if (finishReason != null) {
                span.setAttribute(TelemetryConstants.RESPONSE_FINISH_REASONS,
                        Collections.singletonList(finishReason.getValue()));
            }
            if (usage != null) {
                span.setAttribute(TelemetryConstants.USAGE_INPUT_TOKENS, (long) usage.getInputTokenCount());
                span.setAttribute(TelemetryConstants.USAGE_OUTPUT_TOKENS, (long) usage.getOutputTokenCount());
            }
            if (errorType != null) {
                span.setAttribute(TelemetryConstants.ERROR_TYPE, errorType);
                span.setStatus(StatusCode.ERROR, error != null && error.getMessage() != null ? error.getMessage() : errorType);
            }
            if (error != null) {
                span.recordException(error);
            }

            TelemetrySettings settings = source.getSettings();
            if (hasResponse && settings.isRecordEvents()) {
                source.addEvent(span, TelemetryConstants.EVENT_CHOICE,
                        EventPayloads.choice(finishReason, role, content, toolCalls, settings.isRecordContent()));
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to record {} telemetry", operation, e);
        }
    }

    private Attributes metricAttributes(@Nullable String responseModel, @Nullable String errorType) {
        if (responseModel == null && errorType == null) {
            return commonAttributes;
        }
        AttributesBuilder builder = commonAttributes.toBuilder();
        if (responseModel != null) {
            builder.put(TelemetryConstants.RESPONSE_MODEL, responseModel);
        }
        if (errorType != null) {
            builder.put(TelemetryConstants.ERROR_TYPE, errorType);
        }
        return builder.build();
    }

    private static Attributes tokenAttributes(Attributes metricAttributes, String tokenType) {
        return metricAttributes.toBuilder().put(TelemetryConstants.TOKEN_TYPE, tokenType).build();
    }

    private void recordDuration(Attributes metricAttributes) {
        double seconds = (System.nanoTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
        source.getOperationDuration().record(seconds, metricAttributes);
    }

    /**
     * Ends the span. Subsequent calls are no-ops.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            span.end();
        } catch (RuntimeException e) {
            logger.warn("Failed to end {} span", operation, e);
        }
    }
}
