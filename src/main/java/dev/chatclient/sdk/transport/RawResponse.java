package dev.chatclient.sdk.transport;

import dev.chatclient.sdk.exceptions.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP response as handed back by a {@link ChatTransport}.
 *
 * <p>The body stream is single-pass. Call {@link #bufferContent()} when the
 * body has to be read more than once; streaming consumers read
 * {@link #getContentStream()} directly and must {@link #close()} the response
 * when they are done so the connection is released.
 */
public class RawResponse implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(RawResponse.class);

    private final int status;
    @Nullable
    private InputStream contentStream;
    @Nullable
    private byte[] bufferedContent;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RawResponse(int status, @Nullable InputStream contentStream) {
        this.status = status;
        this.contentStream = contentStream;
    }

    public int getStatus() {
        return status;
    }

    public boolean isSuccessStatus() {
        return status >= 200 && status < 300;
    }

    /**
     * @return the body stream, or null when the transport produced no body
     */
    @Nullable
    public InputStream getContentStream() {
        if (bufferedContent != null) {
            return new ByteArrayInputStream(bufferedContent);
        }
        return contentStream;
    }

    /**
     * Reads the whole body into memory and releases the underlying stream.
     */
    public synchronized void bufferContent() {
        if (bufferedContent != null) {
            return;
        }
        if (contentStream == null) {
            bufferedContent = new byte[0];
            return;
        }
        try (InputStream in = contentStream) {
            bufferedContent = in.readAllBytes();
        } catch (IOException e) {
            throw new ConnectionException("Failed to read response body", e);
        } finally {
            contentStream = null;
        }
    }

    /**
     * Buffers the body if needed and decodes it as UTF-8.
     */
    public String getContentAsString() {
        bufferContent();
        return new String(bufferedContent, StandardCharsets.UTF_8);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the body stream. Subsequent calls are no-ops.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        InputStream stream = contentStream;
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException e) {
                logger.warn("Error closing response body", e);
            }
        }
    }
}
