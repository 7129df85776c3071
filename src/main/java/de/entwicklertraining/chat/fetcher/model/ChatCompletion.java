package de.entwicklertraining.chat.fetcher.model;

import java.util.List;

/**
 * One fully streamed candidate completion.
 *
 * @param index        candidate index within the response
 * @param model        model that actually produced the candidate
 * @param finishReason why the candidate stopped
 * @param text         generated text, already trimmed when the finish reason is client-trimmed
 * @param toolCalls    tool calls requested by the model
 * @param tokens       text deltas in arrival order, used for repetition checks
 * @param usage        token usage, null when not reported
 * @param filterReason filter category when the finish reason is content filter, may be null
 * @param requestId    provider correlation ids
 * @param streamError  error text reported inside the stream, null unless the finish reason is server error
 */
public record ChatCompletion(int index,
                             String model,
                             FinishReason finishReason,
                             String text,
                             List<ToolCallPart> toolCalls,
                             List<String> tokens,
                             Usage usage,
                             FilterReason filterReason,
                             ModelRequestId requestId,
                             String streamError) {

    public ChatCompletion {
        toolCalls = List.copyOf(toolCalls);
        tokens = List.copyOf(tokens);
    }
}
