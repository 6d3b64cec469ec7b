package dev.chatclient.sdk.types.chat;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;

/**
 * Result of a non-streaming chat completion (first choice).
 */
@Getter
@ToString
@Builder
public final class ChatCompletion {

    private final String id;

    @Nullable
    private final String model;

    @Nullable
    private final Instant createdAt;

    @Nullable
    private final ChatMessageRole role;

    @Singular("contentPart")
    private final List<ChatMessageContentPart> content;

    @Singular
    private final List<ChatToolCall> toolCalls;

    @Nullable
    private final ChatFinishReason finishReason;

    @Nullable
    private final ChatTokenUsage usage;

    /**
     * Concatenated text of all text parts.
     */
    public String getText() {
        StringBuilder text = new StringBuilder();
        for (ChatMessageContentPart part : content) {
            if (part.isText()) {
                text.append(part.getText());
            }
        }
        return text.toString();
    }
}
