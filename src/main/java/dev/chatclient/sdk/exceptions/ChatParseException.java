package dev.chatclient.sdk.exceptions;

/**
 * Raised when a response body cannot be decoded.
 */
public class ChatParseException extends ChatClientException {

    private final String payload;

    public ChatParseException(String message, String payload) {
        super(message);
        this.payload = payload;
    }

    public ChatParseException(String message, String payload, Throwable cause) {
        super(message, cause);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }
}
