package de.entwicklertraining.chat.fetcher.transport;

/**
 * Transport-level failure while sending a request or reading its response.
 */
public class FetcherException extends RuntimeException {

    public FetcherException(String message) {
        super(message);
    }

    public FetcherException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The exchange was aborted on purpose, usually because the cancellation token fired.
     */
    public static class AbortedException extends FetcherException {
        public AbortedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The host could not be resolved or reached because there is no network.
     */
    public static class InternetDisconnectedException extends FetcherException {
        public InternetDisconnectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The local network configuration changed underneath an open connection.
     */
    public static class NetworkChangedException extends FetcherException {
        public NetworkChangedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The response body was closed before the stream ended.
     */
    public static class PrematureCloseException extends FetcherException {
        public PrematureCloseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
