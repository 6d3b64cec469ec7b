package dev.chatclient.sdk.types.chat;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;

/**
 * One logical delta of a streaming chat completion.
 *
 * <p>A null or empty field means "unchanged since the previous update".
 */
@Getter
@ToString
@Builder
public final class StreamingChatUpdate {

    @Nullable
    private final String completionId;

    @Nullable
    private final String model;

    @Nullable
    private final Instant createdAt;

    private final int choiceIndex;

    @Nullable
    private final ChatMessageRole role;

    @Singular("contentUpdate")
    private final List<ChatMessageContentPart> contentUpdates;

    @Singular
    private final List<StreamingToolCallUpdate> toolCallUpdates;

    @Nullable
    private final ChatFinishReason finishReason;

    @Nullable
    private final ChatTokenUsage usage;
}
