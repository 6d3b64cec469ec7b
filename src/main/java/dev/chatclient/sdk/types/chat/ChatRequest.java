package dev.chatclient.sdk.types.chat;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Parameters of a chat completion request.
 * Use {@link #builder()} to create instances.
 */
@Getter
@Builder(toBuilder = true)
public class ChatRequest {

    @Singular
    private final List<ChatMessage> messages;

    /**
     * Overrides the client's configured model for this request.
     */
    @Nullable
    private final String model;

    @Nullable
    private final Integer maxTokens;

    @Nullable
    private final Float temperature;

    @Nullable
    private final Float topP;

    /**
     * Ask the service to append a usage-only chunk at the end of a stream.
     */
    @Builder.Default
    private final boolean includeStreamUsage = false;

    public static ChatRequest of(ChatMessage... messages) {
        return builder().messages(List.of(messages)).build();
    }
}
