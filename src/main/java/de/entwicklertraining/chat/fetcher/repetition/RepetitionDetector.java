package de.entwicklertraining.chat.fetcher.repetition;

import java.util.List;

/**
 * Detects degenerate completions that loop over the same tokens.
 */
public interface RepetitionDetector {

    /**
     * @param tokens streamed text deltas in arrival order
     * @return true if the tail of the sequence repeats a short pattern
     */
    boolean isRepetitive(List<String> tokens);

    LineRepetitionStats lineRepetitionStats(String text);
}
