package dev.chatclient.sdk.internal;

import dev.chatclient.sdk.cancellation.CancellationToken;
import dev.chatclient.sdk.exceptions.ConnectionException;
import dev.chatclient.sdk.instrumentation.StreamingScope;
import dev.chatclient.sdk.protocol.ChatMessageParser;
import dev.chatclient.sdk.protocol.ServerSentEvent;
import dev.chatclient.sdk.protocol.ServerSentEventReader;
import dev.chatclient.sdk.transport.RawResponse;
import dev.chatclient.sdk.types.chat.StreamingChatUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-pass iterator over the updates of a streaming chat completion.
 *
 * <p>The response is opened lazily on the first advance. Each server-sent
 * event is decoded into zero or more updates which are handed out in order,
 * after being accumulated into the {@link StreamingScope}. The {@code [DONE]}
 * event or the end of the body completes the stream.
 *
 * <p>The scope is finalized and the response released exactly once, on
 * completion, failure or {@link #close()}. Cancelling the token finalizes the
 * scope as cancelled even when the caller never advances again; the next
 * advance then throws.
 */
public final class StreamingChatUpdateIterator implements Iterator<StreamingChatUpdate>, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(StreamingChatUpdateIterator.class);

    static final String DONE = "[DONE]";

    /**
     * Opens the streaming response. Called at most once.
     */
    @FunctionalInterface
    public interface ResponseSource {
        RawResponse open();
    }

    private enum State {
        NOT_STARTED,
        ITERATING,
        COMPLETED,
        FAILED,
        CLOSED
    }

    private final ResponseSource responseSource;
    private final ChatMessageParser parser;
    private final StreamingScope scope;
    private final CancellationToken cancellationToken;
    private final CancellationToken.Registration cancellationRegistration;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Deque<StreamingChatUpdate> pending = new ArrayDeque<>();

    private volatile State state = State.NOT_STARTED;
    private RawResponse response;
    private ServerSentEventReader events;
    private StreamingChatUpdate current;
    private Boolean hasNext;

    public StreamingChatUpdateIterator(ResponseSource responseSource,
                                       ChatMessageParser parser,
                                       StreamingScope scope,
                                       CancellationToken cancellationToken) {
        this.responseSource = responseSource;
        this.parser = parser;
        this.scope = scope;
        this.cancellationToken = cancellationToken;
        this.cancellationRegistration = cancellationToken.register(scope::recordCancellation);
    }

    /**
     * Advances to the next update.
     *
     * @return false once the stream has completed
     * @throws IllegalStateException if the stream already completed, failed or was closed
     */
    public boolean moveNext() {
        if (state != State.NOT_STARTED && state != State.ITERATING) {
            throw new IllegalStateException("Streaming response is " + state.name().toLowerCase() + " and its resources were released");
        }
        try {
            cancellationToken.throwIfCancellationRequested();
            if (events == null) {
                openEvents();
            }

            while (true) {
                StreamingChatUpdate next = pending.poll();
                if (next != null) {
                    scope.accumulate(next);
                    current = next;
                    return true;
                }

                cancellationToken.throwIfCancellationRequested();
                ServerSentEvent event = events.readNext();
                if (event == null) {
                    logger.debug("Streaming response ended without {}", DONE);
                    complete();
                    return false;
                }
                String data = event.getData();
                if (DONE.equals(data)) {
                    complete();
                    return false;
                }
                if (data.trim().isEmpty()) {
                    continue;
                }
                pending.addAll(parser.parseStreamingUpdates(data));
            }
        } catch (IOException e) {
            ConnectionException failure = new ConnectionException("Failed to read streaming response", e);
            fail(failure);
            throw failure;
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
    }

    /**
     * @return the update produced by the last successful {@link #moveNext()}
     */
    public StreamingChatUpdate getCurrent() {
        if (current == null) {
            throw new IllegalStateException("moveNext() has not produced an update");
        }
        return current;
    }

    private void openEvents() {
        state = State.ITERATING;
        response = responseSource.open();
        InputStream content = response.getContentStream();
        if (content == null) {
            throw new IllegalStateException("Streaming response has no content stream");
        }
        events = new ServerSentEventReader(content);
    }

    @Override
    public boolean hasNext() {
        if (hasNext == null) {
            if (state == State.COMPLETED) {
                return false;
            }
            hasNext = moveNext();
        }
        return hasNext;
    }

    @Override
    public StreamingChatUpdate next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        hasNext = null;
        return current;
    }

    private void complete() {
        state = State.COMPLETED;
        try {
            scope.close();
        } finally {
            release();
        }
    }

    private void fail(Throwable error) {
        state = State.FAILED;
        try {
            scope.recordException(error);
        } finally {
            release();
        }
    }

    /**
     * Finalizes the scope if the stream has not ended yet and releases the
     * response. Safe to call at any time, including before the first advance.
     */
    @Override
    public void close() {
        if (state == State.NOT_STARTED || state == State.ITERATING) {
            state = State.CLOSED;
        }
        hasNext = null;
        try {
            scope.close();
        } finally {
            release();
        }
    }

    private void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        cancellationRegistration.close();
        if (events != null) {
            try {
                events.close();
            } catch (IOException e) {
                logger.warn("Error closing server-sent event reader", e);
            }
        }
        if (response != null) {
            response.close();
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
