package dev.chatclient.sdk.types.chat;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public final class ChatTokenUsage {
    private final int inputTokenCount;
    private final int outputTokenCount;
    private final int totalTokenCount;
}
