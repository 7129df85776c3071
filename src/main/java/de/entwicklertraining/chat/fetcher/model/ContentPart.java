package de.entwicklertraining.chat.fetcher.model;

/**
 * One ordered piece of a {@link ChatMessage}.
 */
public interface ContentPart {
}
