package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ModelRequestId;

import java.time.Instant;
import java.util.Map;

/**
 * A classified non-2xx response.
 *
 * @param status       HTTP status code
 * @param kind         classification
 * @param reason       human readable reason
 * @param requestId    correlation ids from the response headers
 * @param retryAfter   when the caller may try again, null if not known
 * @param rateLimitKey value of {@code x-ratelimit-exceeded}, null if absent
 * @param authorizeUrl URL the user must visit to authorize, only for agent-unauthorized failures
 * @param errorDetails the provider's error object, empty if the body was not JSON
 */
public record ChatRequestFailure(int status,
                                 ChatFailKind kind,
                                 String reason,
                                 ModelRequestId requestId,
                                 Instant retryAfter,
                                 String rateLimitKey,
                                 String authorizeUrl,
                                 Map<String, Object> errorDetails) {
}
