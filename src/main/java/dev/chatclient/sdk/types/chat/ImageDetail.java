package dev.chatclient.sdk.types.chat;

import javax.annotation.Nullable;

public enum ImageDetail {
    AUTO("auto"),
    LOW("low"),
    HIGH("high");

    private final String value;

    ImageDetail(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Nullable
    public static ImageDetail fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        for (ImageDetail detail : values()) {
            if (detail.value.equals(value)) {
                return detail;
            }
        }
        return null;
    }
}
