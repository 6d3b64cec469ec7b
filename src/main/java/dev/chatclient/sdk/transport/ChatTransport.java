package dev.chatclient.sdk.transport;

import dev.chatclient.sdk.cancellation.CancellationToken;

import java.io.Closeable;

/**
 * Transport layer for communication with the chat completions service.
 */
public interface ChatTransport extends Closeable {

    /**
     * POST a JSON body to a path relative to the service endpoint.
     *
     * <p>The returned response owns the unread body; the caller must close it.
     * Non-success statuses are returned, not thrown.
     *
     * @param path      Path below the endpoint, e.g. {@code /chat/completions}
     * @param body      JSON request body
     * @param streaming Whether the caller expects a server-sent event stream
     * @param token     Checked before the request is sent
     * @throws dev.chatclient.sdk.exceptions.ConnectionException if the service cannot be reached
     */
    RawResponse send(String path, String body, boolean streaming, CancellationToken token);

    /**
     * Close the transport and cleanup resources.
     */
    @Override
    void close();
}
