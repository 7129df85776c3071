package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ChatMessage;

import java.util.List;

/**
 * Published after a chat request reached the provider.
 *
 * @param messages   messages that were sent
 * @param model      model the request went to
 * @param tokenCount prompt token count, -1 if it could not be computed
 */
public record MadeChatRequestEvent(List<ChatMessage> messages, String model, int tokenCount) {
}
