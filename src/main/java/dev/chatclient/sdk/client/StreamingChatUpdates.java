package dev.chatclient.sdk.client;

import dev.chatclient.sdk.internal.StreamingChatUpdateIterator;
import dev.chatclient.sdk.types.chat.StreamingChatUpdate;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Updates of one streaming chat completion.
 *
 * <p>Can be iterated once. Close it when stopping early so the connection is
 * released; closing after the stream has ended is harmless.
 *
 * <pre>{@code
 * try (StreamingChatUpdates updates = client.completeChatStreaming(request)) {
 *     for (StreamingChatUpdate update : updates) {
 *         update.getContentUpdates().forEach(part -> System.out.print(part.getText()));
 *     }
 * }
 * }</pre>
 */
public final class StreamingChatUpdates implements Iterable<StreamingChatUpdate>, AutoCloseable {

    private final StreamingChatUpdateIterator iterator;
    private final AtomicBoolean iterated = new AtomicBoolean(false);

    StreamingChatUpdates(StreamingChatUpdateIterator iterator) {
        this.iterator = iterator;
    }

    /**
     * @throws IllegalStateException when called a second time
     */
    @Override
    public Iterator<StreamingChatUpdate> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("Streaming chat updates can only be iterated once");
        }
        return iterator;
    }

    /**
     * Sequential stream over the updates. Closing the stream closes this collection.
     */
    public Stream<StreamingChatUpdate> stream() {
        Spliterator<StreamingChatUpdate> spliterator = Spliterators.spliteratorUnknownSize(
                iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    @Override
    public void close() {
        iterator.close();
    }
}
