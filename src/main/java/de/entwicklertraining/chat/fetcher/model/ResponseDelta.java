package de.entwicklertraining.chat.fetcher.model;

import java.util.List;

/**
 * One incremental piece of a streamed completion.
 *
 * @param text        newly generated text, empty if none
 * @param toolCalls   tool calls completed with this delta
 * @param thinking    newly generated reasoning text, may be null
 * @param retryReason set only on the marker delta emitted before an automatic retry
 */
public record ResponseDelta(String text, List<ToolCallPart> toolCalls, String thinking, String retryReason) {

    public ResponseDelta {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ResponseDelta text(String text) {
        return new ResponseDelta(text, List.of(), null, null);
    }

    public static ResponseDelta thinking(String thinking) {
        return new ResponseDelta("", List.of(), thinking, null);
    }

    public static ResponseDelta toolCalls(List<ToolCallPart> toolCalls) {
        return new ResponseDelta("", toolCalls, null, null);
    }

    public static ResponseDelta retry(String retryReason) {
        return new ResponseDelta("", List.of(), null, retryReason);
    }

    public boolean isRetryMarker() {
        return retryReason != null;
    }
}
