package dev.chatclient.sdk.cancellation;

import dev.chatclient.sdk.exceptions.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a single call.
 *
 * <p>Example usage:
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CallContext context = CallContext.of(token);
 *
 * try (StreamingChatUpdates updates = client.completeChatStreaming(request, context)) {
 *     for (StreamingChatUpdate update : updates) {
 *         if (userPressedStop()) {
 *             token.cancel("stopped by user");
 *         }
 *         render(update);
 *     }
 * }
 * }</pre>
 *
 * <p>Callbacks registered through {@link #register(Runnable)} run on the thread
 * that calls {@link #cancel(String)}.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new ArrayList<>();
    private final CompletableFuture<Void> cancelledFuture = new CompletableFuture<>();
    private volatile String reason = null;

    /**
     * Creates a new token that can be cancelled.
     */
    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Token that is never cancelled. Registrations against it are no-ops.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates an already-cancelled token.
     *
     * @param reason The cancellation reason
     * @return A new token that is already cancelled
     */
    public static CancellationToken cancelled(String reason) {
        CancellationToken token = new CancellationToken();
        token.cancel(reason);
        return token;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Gets the reason for the cancellation, if any.
     *
     * @return The reason, or null if not cancelled or no reason provided
     */
    public String getReason() {
        return reason;
    }

    /**
     * Registers a callback to be invoked when the token is cancelled.
     * If already cancelled, the callback is invoked immediately.
     *
     * @param callback The callback to invoke on cancellation
     * @return A registration that removes the callback when closed
     */
    public synchronized Registration register(Runnable callback) {
        if (!cancellable) {
            return Registration.EMPTY;
        }
        if (cancelled.get()) {
            invoke(callback);
            return Registration.EMPTY;
        }
        listeners.add(callback);
        return () -> unregister(callback);
    }

    private synchronized void unregister(Runnable callback) {
        listeners.remove(callback);
    }

    /**
     * Returns a CompletableFuture that completes when the token is cancelled.
     */
    public CompletableFuture<Void> asCompletableFuture() {
        return cancelledFuture;
    }

    /**
     * Cancels the token, triggering all registered callbacks once.
     *
     * @param reason Optional reason for the cancellation
     */
    public void cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        List<Runnable> snapshot;
        synchronized (this) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            this.reason = reason;
            snapshot = new ArrayList<>(listeners);
            listeners.clear();
        }

        for (Runnable listener : snapshot) {
            invoke(listener);
        }
        cancelledFuture.complete(null);
    }

    /**
     * Cancels the token without a specific reason.
     */
    public void cancel() {
        cancel(null);
    }

    /**
     * Throws an {@link OperationCancelledException} if the token has been cancelled.
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new OperationCancelledException(reason != null ? reason : "Operation cancelled");
        }
    }

    private void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed", e);
        }
    }

    /**
     * Handle returned by {@link #register(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        Registration EMPTY = () -> { };

        @Override
        void close();
    }
}
