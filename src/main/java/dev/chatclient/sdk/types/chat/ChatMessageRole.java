package dev.chatclient.sdk.types.chat;

import javax.annotation.Nullable;

/**
 * Author role of a chat message. Used as the discriminant of {@link ChatMessage}.
 */
public enum ChatMessageRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool"),
    FUNCTION("function");

    private final String value;

    ChatMessageRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the matching role, or null for an unknown wire value
     */
    @Nullable
    public static ChatMessageRole fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        for (ChatMessageRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        return null;
    }
}
