package de.entwicklertraining.chat.fetcher.model;

/**
 * Output of a tool call, answered by a message with role {@link ChatRole#TOOL}.
 */
public record ToolResultPart(String toolCallId, String content) implements ContentPart {
}
