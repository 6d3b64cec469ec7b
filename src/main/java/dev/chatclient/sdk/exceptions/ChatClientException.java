package dev.chatclient.sdk.exceptions;

/**
 * Base exception for all errors raised by the chat client SDK.
 */
public class ChatClientException extends RuntimeException {

    public ChatClientException(String message) {
        super(message);
    }

    public ChatClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
