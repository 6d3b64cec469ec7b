package dev.chatclient.sdk.protocol;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Pull-based decoder for a {@code text/event-stream} body.
 *
 * <p>Nothing is read ahead: each {@link #readNext()} consumes lines only until
 * the next event is complete. Comment lines and {@code retry} fields are
 * skipped. Events without any {@code data} field are not dispatched.
 */
public class ServerSentEventReader implements Closeable {

    private final BufferedReader reader;
    private boolean endOfStream;

    public ServerSentEventReader(InputStream inputStream) {
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    /**
     * @return the next event, or null once the stream is exhausted
     */
    @Nullable
    public ServerSentEvent readNext() throws IOException {
        if (endOfStream) {
            return null;
        }

        StringBuilder data = null;
        String eventType = null;
        String id = null;

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    return new ServerSentEvent(eventType, data.toString(), id);
                }
                eventType = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }

            String field;
            String value;
            int colon = line.indexOf(':');
            if (colon < 0) {
                field = line;
                value = "";
            } else {
                field = line.substring(0, colon);
                value = line.substring(colon + 1);
                if (value.startsWith(" ")) {
                    value = value.substring(1);
                }
            }

            switch (field) {
                case "data":
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                    break;
                case "event":
                    eventType = value;
                    break;
                case "id":
                    id = value;
                    break;
                default:
                    break;
            }
        }

        endOfStream = true;
        if (data != null) {
            return new ServerSentEvent(eventType, data.toString(), id);
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        endOfStream = true;
        reader.close();
    }
}
