package de.entwicklertraining.chat.fetcher.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the available transports and picks one per request. The first registered fetcher is the
 * primary one.
 */
public class FetcherService {

    private static final Logger logger = LoggerFactory.getLogger(FetcherService.class);

    private final Map<FetcherId, Fetcher> fetchers = new LinkedHashMap<>();
    private final Fetcher primary;

    public FetcherService(List<Fetcher> fetchers) {
        if (fetchers.isEmpty()) {
            throw new IllegalArgumentException("At least one fetcher is required");
        }
        fetchers.forEach(fetcher -> this.fetchers.put(fetcher.id(), fetcher));
        this.primary = fetchers.get(0);
    }

    /**
     * HTTP/2 client as primary, HTTP/1.1 client as alternate.
     */
    public static FetcherService createDefault(FetcherHttpConfiguration configuration) {
        return new FetcherService(List.of(HttpClientFetcher.http2(configuration), HttpClientFetcher.http1(configuration)));
    }

    /**
     * @param preferred requested fetcher, may be null
     * @return the requested fetcher if registered, otherwise the primary one
     */
    public Fetcher getFetcher(FetcherId preferred) {
        if (preferred == null) {
            return primary;
        }
        Fetcher fetcher = fetchers.get(preferred);
        if (fetcher == null) {
            logger.debug("Fetcher {} is not registered, using {}", preferred, primary.id());
            return primary;
        }
        return fetcher;
    }

    /**
     * The first registered fetcher other than {@code current}.
     */
    public Optional<FetcherId> alternateTo(FetcherId current) {
        FetcherId effective = current != null ? current : primary.id();
        return fetchers.keySet().stream().filter(id -> id != effective).findFirst();
    }

    public boolean isAbortError(Throwable error) {
        return fetchers.values().stream().anyMatch(f -> f.isAbortError(error));
    }

    public boolean isInternetDisconnectedError(Throwable error) {
        return fetchers.values().stream().anyMatch(f -> f.isInternetDisconnectedError(error));
    }

    public boolean isNetworkChangedError(Throwable error) {
        return fetchers.values().stream().anyMatch(f -> f.isNetworkChangedError(error));
    }

    public boolean isPrematureCloseError(Throwable error) {
        return fetchers.values().stream().anyMatch(f -> f.isPrematureCloseError(error));
    }

    public boolean isFetcherError(Throwable error) {
        return fetchers.values().stream().anyMatch(f -> f.isFetcherError(error));
    }

    public String getUserMessageForFetcherError(Throwable error) {
        return primary.getUserMessageForFetcherError(error);
    }
}
