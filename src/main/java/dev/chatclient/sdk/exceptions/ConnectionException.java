package dev.chatclient.sdk.exceptions;

/**
 * Raised when the service cannot be reached or the connection drops while a
 * response body is being read.
 */
public class ConnectionException extends ChatClientException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
