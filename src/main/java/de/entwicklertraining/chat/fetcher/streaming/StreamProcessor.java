package de.entwicklertraining.chat.fetcher.streaming;

/**
 * Parses the lines of a streamed response body and reports the decoded chunks to a handler.
 *
 * @param <T> the type of data chunks produced by this processor
 */
public interface StreamProcessor<T> {

    /**
     * Processes a single line of the stream. Malformed lines are skipped rather than reported.
     *
     * @param line    the raw line, without its line terminator
     * @param handler receives decoded chunks and the completion signal
     * @throws StreamProcessingException if the stream cannot be processed any further
     */
    void processLine(String line, StreamingResponseHandler<T> handler) throws StreamProcessingException;

    /**
     * @return true if {@code line} is the stream's completion signal
     */
    boolean isCompletionLine(String line);

    /**
     * Clears per-stream state so the processor can be reused.
     */
    default void reset() {
    }

    /**
     * Thrown when a stream cannot be processed any further.
     */
    class StreamProcessingException extends Exception {
        public StreamProcessingException(String message) {
            super(message);
        }

        public StreamProcessingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
