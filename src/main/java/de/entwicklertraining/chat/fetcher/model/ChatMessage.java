package de.entwicklertraining.chat.fetcher.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single message of a conversation: a role plus ordered content parts.
 */
public record ChatMessage(ChatRole role, List<ContentPart> content, String name) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        content = List.copyOf(content);
    }

    public ChatMessage(ChatRole role, List<ContentPart> content) {
        this(role, content, null);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(ChatRole.SYSTEM, List.of(new TextPart(text)));
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(ChatRole.USER, List.of(new TextPart(text)));
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(ChatRole.ASSISTANT, List.of(new TextPart(text)));
    }

    public static ChatMessage toolResult(String toolCallId, String content) {
        return new ChatMessage(ChatRole.TOOL, List.of(new ToolResultPart(toolCallId, content)));
    }

    /**
     * Concatenated text of all {@link TextPart}s.
     */
    public String text() {
        return content.stream()
                .filter(TextPart.class::isInstance)
                .map(p -> ((TextPart) p).text())
                .collect(Collectors.joining());
    }

    public List<ToolCallPart> toolCalls() {
        return content.stream()
                .filter(ToolCallPart.class::isInstance)
                .map(ToolCallPart.class::cast)
                .collect(Collectors.toList());
    }

    public boolean hasImages() {
        return content.stream().anyMatch(ImagePart.class::isInstance);
    }
}
