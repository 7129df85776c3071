package de.entwicklertraining.chat.fetcher;

import java.time.Instant;

/**
 * Snapshot of one finished chat request, handed to the consumer of a {@link CapturingRequestLogger}.
 *
 * @param debugName        name of the calling feature
 * @param model            model the request went to
 * @param startTime        when the request was started
 * @param endTime          when the request was resolved
 * @param timeToFirstToken millis until the response headers arrived, -1 if they never did
 * @param outcome          terminal response type
 * @param reason           reason of a non-success outcome, null on success
 * @param requestBody      request body as JSON, null if none was built
 * @param responseText     concatenated streamed text
 */
public record ChatRequestCapture(String debugName,
                                 String model,
                                 Instant startTime,
                                 Instant endTime,
                                 long timeToFirstToken,
                                 ChatFetchResponseType outcome,
                                 String reason,
                                 String requestBody,
                                 String responseText) {
}
