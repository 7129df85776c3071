package de.entwicklertraining.chat.fetcher.endpoint;

import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;

import java.util.List;

/**
 * Input for {@link ChatEndpoint#createRequestBody}.
 *
 * @param debugName            name of the calling feature, for logging
 * @param messages             conversation to send
 * @param options              fully prepared request options
 * @param ignoreStatefulMarker whether a server-side continuation marker must not be sent
 */
public record ChatEndpointRequest(String debugName,
                                  List<ChatMessage> messages,
                                  ChatRequestOptions options,
                                  boolean ignoreStatefulMarker) {
}
