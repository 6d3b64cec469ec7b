package dev.chatclient.sdk.exceptions;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a call observes that its {@link dev.chatclient.sdk.cancellation.CancellationToken}
 * has been cancelled.
 */
public class OperationCancelledException extends CancellationException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
