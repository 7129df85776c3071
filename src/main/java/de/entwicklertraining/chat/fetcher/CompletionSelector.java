package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ChatCompletion;
import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.repetition.LineRepetitionStats;
import de.entwicklertraining.chat.fetcher.repetition.RepetitionDetector;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetryData;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns the candidates of a successful stream into a single {@link ChatResponse}.
 *
 * <p>Repetitive candidates are removed from the success pool. The remaining candidates with a
 * successful finish reason form a {@code SUCCESS}; if there is none, the first remaining candidate
 * decides the outcome.
 */
public class CompletionSelector {

    private static final Logger logger = LoggerFactory.getLogger(CompletionSelector.class);

    static final int LINE_REPETITION_THRESHOLD = 10;

    private final RepetitionDetector repetitionDetector;
    private final TelemetrySink telemetry;

    public CompletionSelector(RepetitionDetector repetitionDetector, TelemetrySink telemetry) {
        this.repetitionDetector = repetitionDetector;
        this.telemetry = telemetry;
    }

    public ChatResponse select(List<ChatCompletion> completions, String requestId, Map<String, String> telemetryProperties) {
        List<ChatCompletion> remaining = new ArrayList<>();
        List<ChatCompletion> successful = new ArrayList<>();
        for (ChatCompletion completion : completions) {
            if (isRepetitive(completion, telemetryProperties)) {
                logger.debug("[{}] Dropping repetitive candidate {}", requestId, completion.index());
                continue;
            }
            remaining.add(completion);
            if (completion.finishReason().isSuccessful()) {
                successful.add(completion);
            }
        }

        if (!successful.isEmpty()) {
            ChatCompletion first = successful.get(0);
            return ChatResponse.builder(ChatFetchResponseType.SUCCESS, requestId)
                    .serverRequestId(first.requestId().headerRequestId())
                    .resolvedModel(first.model())
                    .usage(successful.size() == 1 ? first.usage() : null)
                    .values(successful.stream().map(ChatCompletion::text).collect(Collectors.toList()))
                    .build();
        }

        if (remaining.isEmpty()) {
            return ChatResponse.builder(ChatFetchResponseType.UNKNOWN, requestId)
                    .reason("Response contained no choices.")
                    .build();
        }

        ChatCompletion first = remaining.get(0);
        String serverRequestId = first.requestId().headerRequestId();
        switch (first.finishReason()) {
            case CONTENT_FILTER:
                return ChatResponse.builder(ChatFetchResponseType.FILTERED_RETRY, requestId)
                        .serverRequestId(serverRequestId)
                        .reason("Response got filtered.")
                        .category(first.filterReason() != null ? first.filterReason() : FilterReason.COPYRIGHT)
                        .values(remaining.stream().map(ChatCompletion::text).collect(Collectors.toList()))
                        .build();
            case LENGTH:
                return ChatResponse.builder(ChatFetchResponseType.LENGTH, requestId)
                        .serverRequestId(serverRequestId)
                        .reason("Response too long.")
                        .truncatedValue(first.text())
                        .build();
            case SERVER_ERROR:
                return ChatResponse.builder(ChatFetchResponseType.SERVER_ERROR, requestId)
                        .serverRequestId(serverRequestId)
                        .reason("Server error. Stream terminated")
                        .streamError(first.streamError())
                        .build();
            default:
                return ChatResponse.builder(ChatFetchResponseType.UNKNOWN, requestId)
                        .serverRequestId(serverRequestId)
                        .reason("Response contained no choices.")
                        .build();
        }
    }

    private boolean isRepetitive(ChatCompletion completion, Map<String, String> telemetryProperties) {
        boolean repetitive = repetitionDetector.isRepetitive(completion.tokens());
        if (repetitive) {
            telemetry.sendEvent("conversation.repetition.detected", TelemetryData.create()
                    .properties(telemetryProperties)
                    .property("headerRequestId", completion.requestId().headerRequestId())
                    .property("completionId", completion.requestId().completionId()));
        }

        LineRepetitionStats stats = repetitionDetector.lineRepetitionStats(completion.text());
        if (stats.numberOfRepetitions() >= LINE_REPETITION_THRESHOLD) {
            telemetry.sendEvent("conversation.repetition.detected", TelemetryData.create()
                    .property("requestId", completion.requestId().headerRequestId())
                    .property("finishReason", completion.finishReason().wireName())
                    .measurement("numberOfRepetitions", stats.numberOfRepetitions())
                    .measurement("lengthOfLine", stats.mostRepeatedLine().length())
                    .measurement("totalLines", stats.totalLines()));
        }
        return repetitive;
    }
}
