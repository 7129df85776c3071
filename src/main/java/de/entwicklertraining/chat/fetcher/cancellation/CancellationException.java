package de.entwicklertraining.chat.fetcher.cancellation;

/**
 * Thrown when an operation observes that its {@link CancellationToken} has been cancelled.
 */
public class CancellationException extends RuntimeException {

    public CancellationException(String message) {
        super(message);
    }

    public CancellationException(String message, Throwable cause) {
        super(message, cause);
    }
}
