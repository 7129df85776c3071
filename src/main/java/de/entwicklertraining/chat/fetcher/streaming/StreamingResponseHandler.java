package de.entwicklertraining.chat.fetcher.streaming;

import java.util.Map;

/**
 * Callbacks invoked while a streamed response is read.
 *
 * <p>All callbacks are invoked on the reading thread, in arrival order:
 * <ol>
 *   <li>any number of {@link #onData(Object)} and {@link #onMetadata(Map)} calls</li>
 *   <li>{@link #onComplete()} when the completion signal is seen</li>
 * </ol>
 *
 * @param <T> the type of data chunks in the stream
 */
public interface StreamingResponseHandler<T> {

    void onData(T data);

    /**
     * Called when the stream's completion signal has been received.
     */
    void onComplete();

    /**
     * Called with SSE {@code event}, {@code id} and {@code retry} fields that precede a data line.
     */
    default void onMetadata(Map<String, Object> metadata) {
    }

    /**
     * Polled before every line. Returning true stops reading.
     */
    default boolean shouldCancel() {
        return false;
    }
}
