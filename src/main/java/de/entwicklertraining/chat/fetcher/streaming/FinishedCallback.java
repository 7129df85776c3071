package de.entwicklertraining.chat.fetcher.streaming;

import de.entwicklertraining.chat.fetcher.model.ResponseDelta;

/**
 * Receives the deltas of a streamed completion as they arrive.
 */
@FunctionalInterface
public interface FinishedCallback {

    /**
     * @param text  full text of candidate {@code index} received so far
     * @param index candidate index
     * @param delta the newly received piece
     * @return an offset into {@code text} at which the candidate should be cut off and finished,
     *         or null to keep streaming
     */
    Integer onDelta(String text, int index, ResponseDelta delta);
}
