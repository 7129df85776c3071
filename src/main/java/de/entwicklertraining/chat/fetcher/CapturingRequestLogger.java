package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link RequestLogger} that turns every finished request into a {@link ChatRequestCapture}.
 * Consumer failures are logged and never reach the request.
 */
public class CapturingRequestLogger implements RequestLogger {

    private static final Logger logger = LoggerFactory.getLogger(CapturingRequestLogger.class);

    private final Consumer<ChatRequestCapture> consumer;
    private final Clock clock;

    public CapturingRequestLogger(Consumer<ChatRequestCapture> consumer, Clock clock) {
        this.consumer = consumer;
        this.clock = clock;
    }

    @Override
    public PendingLoggedChatRequest begin(String debugName, String model, JSONObject body) {
        return new Pending(debugName, model, body != null ? body.toString() : null, clock.instant());
    }

    private final class Pending implements PendingLoggedChatRequest {
        private final String debugName;
        private final String model;
        private final String requestBody;
        private final Instant startTime;
        private final AtomicBoolean resolved = new AtomicBoolean(false);
        private volatile long timeToFirstToken = -1;

        private Pending(String debugName, String model, String requestBody, Instant startTime) {
            this.debugName = debugName;
            this.model = model;
            this.requestBody = requestBody;
            this.startTime = startTime;
        }

        @Override
        public void markTimeToFirstToken(long millis) {
            timeToFirstToken = millis;
        }

        @Override
        public void resolve(ChatResponse response, List<ResponseDelta> deltas) {
            String text = deltas.stream()
                    .filter(delta -> !delta.isRetryMarker())
                    .map(ResponseDelta::text)
                    .collect(Collectors.joining());
            emit(response.getType(), response.isSuccess() ? null : response.getReason(), text);
        }

        @Override
        public void resolveCancelled() {
            emit(ChatFetchResponseType.CANCELED, "cancelled", "");
        }

        private void emit(ChatFetchResponseType outcome, String reason, String text) {
            if (!resolved.compareAndSet(false, true)) {
                logger.warn("Request '{}' was resolved more than once", debugName);
                return;
            }
            ChatRequestCapture capture = new ChatRequestCapture(debugName, model, startTime, clock.instant(),
                    timeToFirstToken, outcome, reason, requestBody, text);
            try {
                consumer.accept(capture);
            } catch (RuntimeException e) {
                logger.warn("Request capture consumer failed for '{}': {}", debugName, e.getMessage(), e);
            }
        }
    }
}
