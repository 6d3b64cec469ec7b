package dev.chatclient.sdk.types.chat;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A function tool call requested by the model.
 */
@Data
@AllArgsConstructor
public final class ChatToolCall {
    private final String id;
    private final String functionName;
    private final String functionArguments;

    public String getKind() {
        return "function";
    }
}
