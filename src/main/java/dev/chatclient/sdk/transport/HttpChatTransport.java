package dev.chatclient.sdk.transport;

import dev.chatclient.sdk.cancellation.CancellationToken;
import dev.chatclient.sdk.exceptions.ConnectionException;
import dev.chatclient.sdk.exceptions.OperationCancelledException;
import dev.chatclient.sdk.types.options.ChatClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link ChatTransport} backed by {@link java.net.http.HttpClient}.
 *
 * <p>Both unary and streaming calls receive the body as an unbuffered
 * {@link InputStream}; buffering is left to the caller.
 */
public class HttpChatTransport implements ChatTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpChatTransport.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final Map<String, String> headers;

    public HttpChatTransport(ChatClientOptions options) {
        this(HttpClient.newBuilder()
                        .connectTimeout(options.getTimeout())
                        .build(),
                options);
    }

    public HttpChatTransport(HttpClient httpClient, ChatClientOptions options) {
        this.httpClient = httpClient;
        this.endpoint = options.getEndpoint();
        this.apiKey = options.getApiKey();
        this.timeout = options.getTimeout();
        this.headers = options.getHeaders();
    }

    @Override
    public RawResponse send(String path, String body, boolean streaming, CancellationToken token) {
        token.throwIfCancellationRequested();

        HttpRequest request = buildHttpRequest(path, body, streaming);
        logger.debug("→ POST {} streaming={} body-length={}", request.uri(), streaming, body.length());

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new ConnectionException("Network error calling " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while calling " + request.uri());
        }

        logger.debug("← HTTP {} from {}", response.statusCode(), request.uri());
        return new RawResponse(response.statusCode(), response.body());
    }

    private HttpRequest buildHttpRequest(String path, String body, boolean streaming) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(path))
                .header("Content-Type", "application/json")
                .header("Accept", streaming ? "text/event-stream" : "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));

        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        headers.forEach(builder::header);

        // Streaming responses have no upper bound on duration
        if (!streaming) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    private URI resolve(String path) {
        String base = endpoint.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    @Override
    public void close() {
        // HttpClient has no close() on JDK 17; idle connections are reclaimed by its selector thread
    }
}
