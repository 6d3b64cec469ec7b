package dev.chatclient.sdk.types.chat;

import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * Partial tool call delivered in a streaming update. Fragments sharing an
 * {@code index} belong to the same call; argument fragments are appended in
 * arrival order.
 */
@Data
@AllArgsConstructor
public final class StreamingToolCallUpdate {
    private final int index;
    @Nullable
    private final String id;
    @Nullable
    private final String functionName;
    @Nullable
    private final String functionArgumentsUpdate;
}
