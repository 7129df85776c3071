package de.entwicklertraining.chat.fetcher.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Status, headers and an unread body stream of one HTTP exchange.
 *
 * <p>{@link #destroy()} closes the body and may be called any number of times from any thread;
 * the underlying stream is torn down only once.
 */
public final class FetchResponse implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FetchResponse.class);

    private final int status;
    private final HttpHeaders headers;
    private final InputStream body;
    private final Runnable onDestroy;
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    public FetchResponse(int status, HttpHeaders headers, InputStream body) {
        this(status, headers, body, null);
    }

    /**
     * @param onDestroy runs once, after the body has been closed, may be null
     */
    public FetchResponse(int status, HttpHeaders headers, InputStream body, Runnable onDestroy) {
        this.status = status;
        this.headers = headers;
        this.body = body;
        this.onDestroy = onDestroy;
    }

    public static FetchResponse of(int status, Map<String, String> headers, String body) {
        return new FetchResponse(status, headersOf(headers),
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    public static HttpHeaders headersOf(Map<String, String> headers) {
        Map<String, List<String>> multi = headers.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> List.of(e.getValue())));
        return HttpHeaders.of(multi, (name, value) -> true);
    }

    public int status() {
        return status;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    /**
     * Reads the remaining body as UTF-8 text.
     */
    public String text() {
        try {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            if (destroyed.get()) {
                throw new FetcherException.PrematureCloseException("Premature close", e);
            }
            throw new FetcherException("Failed to read response body: " + e.getMessage(), e);
        }
    }

    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            logger.error("Failed to close response body", e);
        }
        if (onDestroy != null) {
            onDestroy.run();
        }
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    @Override
    public void close() {
        destroy();
    }
}
