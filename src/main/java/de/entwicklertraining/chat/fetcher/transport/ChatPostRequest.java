package de.entwicklertraining.chat.fetcher.transport;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.endpoint.ChatEndpoint;
import org.json.JSONObject;

import java.util.Map;

/**
 * Everything {@link ChatRequestTransport#post} needs to send one chat request.
 *
 * @param endpoint            target endpoint
 * @param secretKey           bearer credential
 * @param intent              value of the {@code OpenAI-Intent} header
 * @param requestId           our correlation id, sent as {@code X-Request-Id}
 * @param body                request body
 * @param userInitiated       whether the user triggered this request directly
 * @param fetcherId           preferred transport, may be null
 * @param token               aborts the exchange while waiting for headers
 * @param telemetryProperties properties added to every transport telemetry event
 */
public record ChatPostRequest(ChatEndpoint endpoint,
                              String secretKey,
                              String intent,
                              String requestId,
                              JSONObject body,
                              boolean userInitiated,
                              FetcherId fetcherId,
                              CancellationToken token,
                              Map<String, String> telemetryProperties) {
}
