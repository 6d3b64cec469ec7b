package dev.chatclient.sdk.instrumentation;

import dev.chatclient.sdk.types.chat.ChatFinishReason;
import dev.chatclient.sdk.types.chat.ChatMessageContentPart;
import dev.chatclient.sdk.types.chat.ChatMessageRole;
import dev.chatclient.sdk.types.chat.ChatTokenUsage;
import dev.chatclient.sdk.types.chat.ChatToolCall;
import dev.chatclient.sdk.types.chat.ImageDetail;
import dev.chatclient.sdk.types.chat.StreamingChatUpdate;
import dev.chatclient.sdk.types.chat.StreamingToolCallUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accumulates the updates of one streaming chat completion and reports the
 * aggregate exactly once.
 *
 * <p>Scalar fields keep the last non-null value seen. Text fragments are
 * concatenated; tool call fragments are merged by index. Only the first
 * choice contributes content, role, tool calls and finish reason.
 *
 * <p>{@link #close()}, {@link #recordException(Throwable)} and
 * {@link #recordCancellation()} all finalize the scope; whichever runs first
 * wins and the others do nothing. They may race from different threads.
 * Each of them reports what has been accumulated so far, with the error
 * type of its cause.
 */
public final class StreamingScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StreamingScope.class);

    /**
     * Tool call indices at or above this bound are dropped instead of backfilled.
     */
    static final int MAX_TOOL_CALLS = 1024;

    @Nullable
    private final InstrumentationScope scope;
    private final AtomicBoolean reported = new AtomicBoolean(false);

    private String responseId;
    private String responseModel;
    private ChatMessageRole role;
    private ChatFinishReason finishReason;
    private ChatTokenUsage usage;
    private final ContentBuffer content = new ContentBuffer();
    private final List<ToolCallBuffer> toolCalls = new ArrayList<>();

    /**
     * @param scope sink for the report, or null when the call is not instrumented
     */
    public StreamingScope(@Nullable InstrumentationScope scope) {
        this.scope = scope;
    }

    public void accumulate(StreamingChatUpdate update) {
        if (update.getCompletionId() != null) {
            responseId = update.getCompletionId();
        }
        if (update.getModel() != null) {
            responseModel = update.getModel();
        }
        if (update.getUsage() != null) {
            usage = update.getUsage();
        }
        if (update.getChoiceIndex() != 0) {
            return;
        }

        if (update.getRole() != null) {
            role = update.getRole();
        }
        if (update.getFinishReason() != null) {
            finishReason = update.getFinishReason();
        }
        for (ChatMessageContentPart part : update.getContentUpdates()) {
            content.append(part);
        }
        for (StreamingToolCallUpdate toolCallUpdate : update.getToolCallUpdates()) {
            int index = toolCallUpdate.getIndex();
            if (index < 0 || index >= MAX_TOOL_CALLS) {
                logger.warn("Ignoring tool call update with index {} outside [0, {})", index, MAX_TOOL_CALLS);
                continue;
            }
            ensureToolCallCapacity(index);
            toolCalls.get(index).append(toolCallUpdate);
        }
    }

    private void ensureToolCallCapacity(int index) {
        while (toolCalls.size() <= index) {
            toolCalls.add(new ToolCallBuffer());
        }
    }

    /**
     * Finalizes as completed.
     */
    @Override
    public void close() {
        finish(null, false);
    }

    public void recordException(Throwable error) {
        finish(error, false);
    }

    public void recordCancellation() {
        finish(null, true);
    }

    private void finish(@Nullable Throwable error, boolean cancelled) {
        if (!reported.compareAndSet(false, true) || scope == null) {
            return;
        }
        try {
            List<ChatToolCall> calls = new ArrayList<>(toolCalls.size());
            for (ToolCallBuffer buffer : toolCalls) {
                calls.add(buffer.toToolCall());
            }
            scope.recordStreamingChatCompletion(responseId, responseModel, role, finishReason, usage,
                    content.toContentPart(), calls, error, cancelled);
        } finally {
            scope.close();
        }
    }

    public boolean isReported() {
        return reported.get();
    }

    /**
     * Text accumulated so far, or the image reference when one was seen.
     */
    static final class ContentBuffer {
        private final StringBuilder text = new StringBuilder();
        private URI imageUri;
        private ImageDetail imageDetail;

        void append(ChatMessageContentPart part) {
            if (part.isImage()) {
                imageUri = part.getImageUri();
                imageDetail = part.getImageDetail();
            } else if (part.getText() != null) {
                text.append(part.getText());
            }
        }

        ChatMessageContentPart toContentPart() {
            if (imageUri != null) {
                return ChatMessageContentPart.image(imageUri, imageDetail);
            }
            return ChatMessageContentPart.text(text.toString());
        }
    }

    static final class ToolCallBuffer {
        private String id;
        private String functionName;
        private StringBuilder arguments;

        void append(StreamingToolCallUpdate update) {
            if (update.getId() != null) {
                id = update.getId();
            }
            if (update.getFunctionName() != null) {
                functionName = update.getFunctionName();
            }
            if (update.getFunctionArgumentsUpdate() != null) {
                if (arguments == null) {
                    arguments = new StringBuilder();
                }
                arguments.append(update.getFunctionArgumentsUpdate());
            }
        }

        ChatToolCall toToolCall() {
            return new ChatToolCall(
                    id,
                    functionName != null ? functionName : "",
                    arguments != null ? arguments.toString() : "");
        }
    }
}
