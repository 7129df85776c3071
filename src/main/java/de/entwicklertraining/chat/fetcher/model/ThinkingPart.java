package de.entwicklertraining.chat.fetcher.model;

public record ThinkingPart(String text) implements ContentPart {
}
