package dev.chatclient.sdk.types.chat;

import javax.annotation.Nullable;

/**
 * Why the model stopped generating.
 */
public enum ChatFinishReason {
    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter"),
    FUNCTION_CALL("function_call");

    private final String value;

    ChatFinishReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Nullable
    public static ChatFinishReason fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        for (ChatFinishReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        return null;
    }
}
