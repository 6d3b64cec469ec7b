package dev.chatclient.sdk.support;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Byte stream that remembers whether it was closed and can fail with an
 * {@link IOException} once its content has been read, like a dropped connection.
 */
public class TrackingInputStream extends InputStream {

    private final ByteArrayInputStream delegate;
    private final boolean failAtEnd;
    private volatile boolean closed;

    public TrackingInputStream(String content) {
        this(content, false);
    }

    public TrackingInputStream(String content, boolean failAtEnd) {
        this.delegate = new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
        this.failAtEnd = failAtEnd;
    }

    @Override
    public int read() throws IOException {
        int value = delegate.read();
        if (value == -1 && failAtEnd) {
            throw new IOException("connection reset");
        }
        return value;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int count = delegate.read(b, off, len);
        if (count == -1 && failAtEnd) {
            throw new IOException("connection reset");
        }
        return count;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
