package dev.chatclient.sdk.types.chat;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A message in a chat conversation, tagged by its {@link ChatMessageRole}.
 *
 * <p>Which optional fields are meaningful depends on the role: assistant
 * messages may carry {@link #getToolCalls()}, tool messages carry
 * {@link #getToolCallId()}, function messages carry {@link #getName()}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class ChatMessage {

    @NonNull
    private final ChatMessageRole role;

    @Singular("contentPart")
    private final List<ChatMessageContentPart> content;

    @Singular
    private final List<ChatToolCall> toolCalls;

    @Nullable
    private final String toolCallId;

    @Nullable
    private final String name;

    public static ChatMessage system(String text) {
        return builder().role(ChatMessageRole.SYSTEM).contentPart(ChatMessageContentPart.text(text)).build();
    }

    public static ChatMessage user(String text) {
        return builder().role(ChatMessageRole.USER).contentPart(ChatMessageContentPart.text(text)).build();
    }

    public static ChatMessage user(List<ChatMessageContentPart> parts) {
        return builder().role(ChatMessageRole.USER).content(parts).build();
    }

    public static ChatMessage assistant(String text) {
        return builder().role(ChatMessageRole.ASSISTANT).contentPart(ChatMessageContentPart.text(text)).build();
    }

    public static ChatMessage assistant(List<ChatToolCall> toolCalls) {
        return builder().role(ChatMessageRole.ASSISTANT).toolCalls(toolCalls).build();
    }

    public static ChatMessage tool(String toolCallId, String text) {
        return builder()
                .role(ChatMessageRole.TOOL)
                .toolCallId(toolCallId)
                .contentPart(ChatMessageContentPart.text(text))
                .build();
    }

    public static ChatMessage function(String name, String text) {
        return builder()
                .role(ChatMessageRole.FUNCTION)
                .name(name)
                .contentPart(ChatMessageContentPart.text(text))
                .build();
    }
}
