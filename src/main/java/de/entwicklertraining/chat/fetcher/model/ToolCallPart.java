package de.entwicklertraining.chat.fetcher.model;

/**
 * A tool invocation requested by the assistant. {@code arguments} is the raw JSON argument string.
 */
public record ToolCallPart(String id, String name, String arguments) implements ContentPart {
}
