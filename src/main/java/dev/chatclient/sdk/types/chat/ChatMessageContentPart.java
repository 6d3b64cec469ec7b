package dev.chatclient.sdk.types.chat;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import javax.annotation.Nullable;
import java.net.URI;
import java.util.Objects;

/**
 * One part of a message's content: either text or an image reference.
 * Check {@link #getKind()} before reading the variant-specific fields.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ChatMessageContentPart {

    private final ContentPartKind kind;
    @Nullable
    private final String text;
    @Nullable
    private final URI imageUri;
    @Nullable
    private final ImageDetail imageDetail;

    private ChatMessageContentPart(ContentPartKind kind, String text, URI imageUri, ImageDetail imageDetail) {
        this.kind = kind;
        this.text = text;
        this.imageUri = imageUri;
        this.imageDetail = imageDetail;
    }

    public static ChatMessageContentPart text(String text) {
        return new ChatMessageContentPart(ContentPartKind.TEXT, Objects.requireNonNull(text, "text"), null, null);
    }

    public static ChatMessageContentPart image(URI imageUri, @Nullable ImageDetail imageDetail) {
        return new ChatMessageContentPart(ContentPartKind.IMAGE, null, imageUri, imageDetail);
    }

    public boolean isText() {
        return kind == ContentPartKind.TEXT;
    }

    public boolean isImage() {
        return kind == ContentPartKind.IMAGE;
    }
}
