package de.entwicklertraining.chat.fetcher.repetition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flags a token sequence as repetitive when its last tokens consist of a short repeated pattern.
 *
 * <p>The check runs a KMP prefix function over the reversed sequence. For each window the
 * shortest period of the last {@code windowSize} tokens is
 * {@code windowSize - 1 - prefix[windowSize - 1]}; if that period is at most the configured
 * pattern length the completion is considered stuck. The check is repeated with
 * whitespace-only tokens removed.
 */
public class TokenRepetitionDetector implements RepetitionDetector {

    private static final List<Window> WINDOWS = List.of(
            new Window(1, 10),
            new Window(10, 30),
            new Window(20, 45),
            new Window(30, 60));

    @Override
    public boolean isRepetitive(List<String> tokens) {
        List<String> reversed = new ArrayList<>(tokens);
        Collections.reverse(reversed);
        if (isRepeatedPattern(reversed)) {
            return true;
        }
        List<String> withoutWhitespace = new ArrayList<>();
        for (String token : reversed) {
            if (!token.isBlank()) {
                withoutWhitespace.add(token);
            }
        }
        return isRepeatedPattern(withoutWhitespace);
    }

    private static boolean isRepeatedPattern(List<String> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        int[] prefix = prefixFunction(tokens);
        for (Window window : WINDOWS) {
            if (tokens.size() < window.lastTokensToConsider()) {
                continue;
            }
            int last = window.lastTokensToConsider() - 1;
            int patternLength = last - prefix[last];
            if (patternLength <= window.maxTokenSequenceLength()) {
                return true;
            }
        }
        return false;
    }

    // prefix[q] is the index of the last element of the longest proper border of tokens[0..q], -1 if none
    private static int[] prefixFunction(List<String> tokens) {
        int[] prefix = new int[tokens.size()];
        prefix[0] = -1;
        int k = -1;
        for (int q = 1; q < tokens.size(); q++) {
            while (k >= 0 && !Objects.equals(tokens.get(k + 1), tokens.get(q))) {
                k = prefix[k];
            }
            if (Objects.equals(tokens.get(k + 1), tokens.get(q))) {
                k++;
            }
            prefix[q] = k;
        }
        return prefix;
    }

    @Override
    public LineRepetitionStats lineRepetitionStats(String text) {
        String[] lines = text.split("\n", -1);
        Map<String, Integer> counts = new HashMap<>();
        String mostRepeated = "";
        int maxCount = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int count = counts.merge(trimmed, 1, Integer::sum);
            if (count > maxCount) {
                maxCount = count;
                mostRepeated = trimmed;
            }
        }
        return new LineRepetitionStats(mostRepeated, maxCount, lines.length);
    }

    private record Window(int maxTokenSequenceLength, int lastTokensToConsider) {
    }
}
