package dev.chatclient.sdk.instrumentation;

import dev.chatclient.sdk.cancellation.CallContext;
import dev.chatclient.sdk.types.chat.ChatMessage;
import dev.chatclient.sdk.types.chat.ChatRequest;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * Creates the spans and instruments for one client.
 *
 * <p>Every {@code start*} method returns null when the given context is
 * already instrumented, so nested calls are not reported twice.
 */
public class TelemetrySource {

    private static final Logger logger = LoggerFactory.getLogger(TelemetrySource.class);

    private static final List<Double> DURATION_BUCKETS = Arrays.asList(
            0.01, 0.02, 0.04, 0.08, 0.16, 0.32, 0.64, 1.28, 2.56, 5.12, 10.24, 20.48, 40.96, 81.92);
    private static final List<Long> TOKEN_BUCKETS = Arrays.asList(
            1L, 4L, 16L, 64L, 256L, 1024L, 4096L, 16384L, 65536L, 262144L, 1048576L, 4194304L, 16777216L, 67108864L);

    private final Tracer tracer;
    private final DoubleHistogram operationDuration;
    private final LongHistogram tokenUsage;
    private final LongCounter streamsStarted;
    private final LongCounter streamsCompleted;
    private final TelemetrySettings settings;
    @Nullable
    private final String defaultModel;

    public TelemetrySource(OpenTelemetry openTelemetry, TelemetrySettings settings, @Nullable String defaultModel) {
        this.settings = settings;
        this.defaultModel = defaultModel;
        this.tracer = openTelemetry.getTracer(TelemetryConstants.INSTRUMENTATION_SCOPE);

        Meter meter = openTelemetry.getMeter(TelemetryConstants.INSTRUMENTATION_SCOPE);
        this.operationDuration = meter.histogramBuilder(TelemetryConstants.METRIC_OPERATION_DURATION)
                .setDescription("Measures the duration of a GenAI operation")
                .setUnit("s")
                .setExplicitBucketBoundariesAdvice(DURATION_BUCKETS)
                .build();
        this.tokenUsage = meter.histogramBuilder(TelemetryConstants.METRIC_TOKEN_USAGE)
                .ofLongs()
                .setDescription("Measures the number of input and output tokens used")
                .setUnit("{token}")
                .setExplicitBucketBoundariesAdvice(TOKEN_BUCKETS)
                .build();
        this.streamsStarted = meter.counterBuilder(TelemetryConstants.METRIC_STREAMS_STARTED)
                .setDescription("Number of streaming chat completions started")
                .build();
        this.streamsCompleted = meter.counterBuilder(TelemetryConstants.METRIC_STREAMS_COMPLETED)
                .setDescription("Number of streaming chat completions finalized")
                .build();
    }

    public TelemetrySettings getSettings() {
        return settings;
    }

    /**
     * Starts the scope of a unary chat completion.
     */
    @Nullable
    public InstrumentationScope startChatScope(ChatRequest request, CallContext context) {
        if (context.isInstrumentationActive()) {
            return null;
        }
        return startChat(request, false);
    }

    /**
     * Starts the scope of a streaming chat completion and counts it as started.
     */
    @Nullable
    public InstrumentationScope startStreamingChatScope(ChatRequest request, CallContext context) {
        if (context.isInstrumentationActive()) {
            return null;
        }
        return startChat(request, true);
    }

    /**
     * Starts the scope of an embedding call made with the given model.
     */
    @Nullable
    public InstrumentationScope startEmbeddingScope(@Nullable String model, CallContext context) {
        if (context.isInstrumentationActive()) {
            return null;
        }
        String requestModel = model != null ? model : defaultModel;
        Attributes common = commonAttributes(TelemetryConstants.OPERATION_EMBEDDING, requestModel);
        Span span = startSpan(spanBuilder(TelemetryConstants.OPERATION_EMBEDDING, requestModel, common));
        return new InstrumentationScope(this, TelemetryConstants.OPERATION_EMBEDDING, common, span, false);
    }

    private InstrumentationScope startChat(ChatRequest request, boolean streaming) {
        String requestModel = request.getModel() != null ? request.getModel() : defaultModel;
        Attributes common = commonAttributes(TelemetryConstants.OPERATION_CHAT, requestModel);

        SpanBuilder builder = spanBuilder(TelemetryConstants.OPERATION_CHAT, requestModel, common);
        if (request.getMaxTokens() != null) {
            builder.setAttribute(TelemetryConstants.REQUEST_MAX_TOKENS, (long) request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            builder.setAttribute(TelemetryConstants.REQUEST_TEMPERATURE, (double) request.getTemperature());
        }
        if (request.getTopP() != null) {
            builder.setAttribute(TelemetryConstants.REQUEST_TOP_P, (double) request.getTopP());
        }
        Span span = startSpan(builder);

        if (settings.isRecordEvents()) {
            try {
                for (ChatMessage message : request.getMessages()) {
                    addEvent(span, TelemetryConstants.messageEventName(message.getRole().getValue()),
                            EventPayloads.message(message, settings.isRecordContent()));
                }
            } catch (RuntimeException e) {
                logger.warn("Failed to record request message events", e);
            }
        }

        if (streaming) {
            try {
                streamsStarted.add(1, common);
            } catch (RuntimeException e) {
                logger.warn("Failed to record stream start", e);
            }
        }
        logger.debug("Started {} scope for model {}", TelemetryConstants.OPERATION_CHAT, requestModel);
        return new InstrumentationScope(this, TelemetryConstants.OPERATION_CHAT, common, span, streaming);
    }

    private static Span startSpan(SpanBuilder builder) {
        try {
            return builder.startSpan();
        } catch (RuntimeException e) {
            logger.warn("Failed to start span, continuing without tracing", e);
            return Span.getInvalid();
        }
    }

    private SpanBuilder spanBuilder(String operation, @Nullable String requestModel, Attributes common) {
        String name = requestModel != null ? operation + " " + requestModel : operation;
        return tracer.spanBuilder(name)
                .setSpanKind(SpanKind.CLIENT)
                .setAllAttributes(common);
    }

    private Attributes commonAttributes(String operation, @Nullable String requestModel) {
        AttributesBuilder builder = Attributes.builder()
                .put(TelemetryConstants.OPERATION_NAME, operation)
                .put(TelemetryConstants.SYSTEM, TelemetryConstants.SYSTEM_NAME);
        if (requestModel != null) {
            builder.put(TelemetryConstants.REQUEST_MODEL, requestModel);
        }
        if (settings.getServerAddress() != null) {
            builder.put(TelemetryConstants.SERVER_ADDRESS, settings.getServerAddress());
            builder.put(TelemetryConstants.SERVER_PORT, (long) settings.getServerPort());
        }
        return builder.build();
    }

    void addEvent(Span span, String name, String payload) {
        span.addEvent(name, Attributes.of(
                TelemetryConstants.SYSTEM, TelemetryConstants.SYSTEM_NAME,
                TelemetryConstants.EVENT_DATA, payload));
    }

    DoubleHistogram getOperationDuration() {
        return operationDuration;
    }

    LongHistogram getTokenUsage() {
        return tokenUsage;
    }

    LongCounter getStreamsCompleted() {
        return streamsCompleted;
    }
}
