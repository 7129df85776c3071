package de.entwicklertraining.chat.fetcher.transport;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link Fetcher} backed by {@link HttpClient}.
 *
 * <p>The request is sent asynchronously so that a cancellation of the token can abort the pending
 * exchange while the caller is still waiting for headers. The body is returned as an unread
 * stream.
 */
public class HttpClientFetcher implements Fetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientFetcher.class);

    private static final ExecutorService HTTP_CLIENT_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "chat-fetcher-http");
        thread.setDaemon(true);
        return thread;
    });

    private final FetcherId id;
    private final HttpClient httpClient;
    private final FetcherHttpConfiguration configuration;

    public HttpClientFetcher(FetcherId id, HttpClient.Version version, FetcherHttpConfiguration configuration) {
        this.id = id;
        this.configuration = configuration;
        this.httpClient = HttpClient.newBuilder()
                .version(version)
                .connectTimeout(configuration.getConnectTimeout())
                .executor(HTTP_CLIENT_EXECUTOR)
                .build();
    }

    public static HttpClientFetcher http2(FetcherHttpConfiguration configuration) {
        return new HttpClientFetcher(FetcherId.HTTP2_CLIENT, HttpClient.Version.HTTP_2, configuration);
    }

    public static HttpClientFetcher http1(FetcherHttpConfiguration configuration) {
        return new HttpClientFetcher(FetcherId.HTTP1_CLIENT, HttpClient.Version.HTTP_1_1, configuration);
    }

    @Override
    public FetcherId id() {
        return id;
    }

    @Override
    public FetchResponse fetch(FetchRequest request, CancellationToken token) {
        if (token.isCancelled()) {
            throw new FetcherException.AbortedException("Request was aborted before it was sent", null);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .POST(HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8));
        configuration.getGlobalHeaders().forEach(builder::setHeader);
        request.headers().forEach(builder::setHeader);
        configuration.getRequestModifiers().forEach(modifier -> modifier.accept(builder));
        HttpRequest httpRequest = builder.build();

        logger.debug("[{}] POST {}", id, request.uri());
        CompletableFuture<HttpResponse<InputStream>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream());

        try (CancellationToken.Registration ignored = token.onCancelled(() -> future.cancel(true))) {
            HttpResponse<InputStream> response = future.get();
            return new FetchResponse(response.statusCode(), response.headers(), response.body());
        } catch (java.util.concurrent.CancellationException e) {
            throw new FetcherException.AbortedException("Request was aborted", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetcherException.AbortedException("Request was interrupted", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause() != null ? e.getCause() : e);
        }
    }

    FetcherException translate(Throwable cause) {
        for (Throwable current = cause; current != null; current = current.getCause()) {
            if (current instanceof UnknownHostException || current instanceof UnresolvedAddressException) {
                return new FetcherException.InternetDisconnectedException("Host could not be resolved: " + cause.getMessage(), cause);
            }
            if (current instanceof NoRouteToHostException || isNetworkUnreachable(current)) {
                return new FetcherException.NetworkChangedException("Network changed: " + cause.getMessage(), cause);
            }
        }
        if (cause instanceof HttpTimeoutException) {
            return new FetcherException("Request timed out: " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException) {
            return new FetcherException("Request failed: " + cause.getMessage(), cause);
        }
        return new FetcherException("Request failed: " + cause, cause);
    }

    private static boolean isNetworkUnreachable(Throwable error) {
        return error instanceof SocketException
                && error.getMessage() != null
                && error.getMessage().toLowerCase(Locale.ROOT).contains("network is unreachable");
    }
}
