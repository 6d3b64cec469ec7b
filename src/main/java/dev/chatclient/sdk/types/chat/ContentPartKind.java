package dev.chatclient.sdk.types.chat;

/**
 * Discriminant of {@link ChatMessageContentPart}.
 */
public enum ContentPartKind {
    TEXT("text"),
    IMAGE("image");

    private final String value;

    ContentPartKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
