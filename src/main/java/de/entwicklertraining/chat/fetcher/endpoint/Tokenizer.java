package de.entwicklertraining.chat.fetcher.endpoint;

import de.entwicklertraining.chat.fetcher.model.ChatMessage;

import java.util.List;

/**
 * Counts prompt tokens for a model. Only used for diagnostics.
 */
@FunctionalInterface
public interface Tokenizer {

    int countMessagesTokens(List<ChatMessage> messages);
}
