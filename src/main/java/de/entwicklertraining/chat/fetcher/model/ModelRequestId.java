package de.entwicklertraining.chat.fetcher.model;

import java.net.http.HttpHeaders;

/**
 * Correlation ids returned by the provider for one response.
 *
 * @param headerRequestId value of {@code x-request-id}
 * @param serverRequestId value of {@code x-github-request-id}
 * @param completionId    {@code id} field of the streamed completion, may be null
 */
public record ModelRequestId(String headerRequestId, String serverRequestId, String completionId) {

    public static ModelRequestId fromHeaders(HttpHeaders headers) {
        return new ModelRequestId(
                headers.firstValue("x-request-id").orElse(""),
                headers.firstValue("x-github-request-id").orElse(""),
                null);
    }

    public ModelRequestId withCompletionId(String completionId) {
        return new ModelRequestId(headerRequestId, serverRequestId, completionId);
    }
}
