package de.entwicklertraining.chat.fetcher.transport;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;

/**
 * An HTTP transport. Besides sending requests it knows how to interpret its own failures.
 */
public interface Fetcher {

    FetcherId id();

    /**
     * Sends {@code request} and returns once the response headers have arrived.
     *
     * @throws FetcherException if the exchange fails or is aborted through {@code token}
     */
    FetchResponse fetch(FetchRequest request, CancellationToken token);

    default boolean isAbortError(Throwable error) {
        return error instanceof FetcherException.AbortedException;
    }

    default boolean isInternetDisconnectedError(Throwable error) {
        return error instanceof FetcherException.InternetDisconnectedException;
    }

    default boolean isNetworkChangedError(Throwable error) {
        return error instanceof FetcherException.NetworkChangedException;
    }

    default boolean isPrematureCloseError(Throwable error) {
        return error instanceof FetcherException.PrematureCloseException;
    }

    default boolean isFetcherError(Throwable error) {
        return error instanceof FetcherException;
    }

    default String getUserMessageForFetcherError(Throwable error) {
        return "Please check your firewall rules and network connection then try again. Error: " + error.getMessage();
    }
}
