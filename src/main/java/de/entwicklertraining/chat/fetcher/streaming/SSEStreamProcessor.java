package de.entwicklertraining.chat.fetcher.streaming;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Stream processor for Server-Sent Events as sent by chat completion providers:
 * <pre>
 * data: {"choices":[{"index":0,"delta":{"content":"Hello"}}]}
 *
 * data: {"choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}
 *
 * data: [DONE]
 * </pre>
 *
 * <p>Every {@code data:} line is parsed as JSON and handed to the {@link DataExtractor}. Lines that
 * are not valid JSON are logged and skipped. {@code event:}, {@code id:} and {@code retry:} fields
 * are collected and reported as metadata together with the next data line.
 *
 * @param <T> the type of data chunks extracted from each JSON payload
 */
public class SSEStreamProcessor<T> implements StreamProcessor<T> {

    private static final Logger logger = LoggerFactory.getLogger(SSEStreamProcessor.class);

    private static final String DONE = "[DONE]";

    private final DataExtractor<T> dataExtractor;

    private String currentEventType;
    private String currentEventId;
    private final Map<String, Object> currentMetadata = new HashMap<>();

    public SSEStreamProcessor(DataExtractor<T> dataExtractor) {
        this.dataExtractor = dataExtractor;
    }

    /**
     * A processor that passes every JSON payload through unchanged.
     */
    public static SSEStreamProcessor<JSONObject> forJson() {
        return new SSEStreamProcessor<>(json -> json);
    }

    @Override
    public void processLine(String line, StreamingResponseHandler<T> handler) throws StreamProcessingException {
        if (line == null || line.isBlank()) {
            // blank line terminates the current event
            reset();
            return;
        }

        line = line.trim();

        if (line.startsWith("data:")) {
            processDataLine(line, handler);
        } else if (line.startsWith("event:")) {
            currentEventType = line.substring(6).trim();
        } else if (line.startsWith("id:")) {
            currentEventId = line.substring(3).trim();
        } else if (line.startsWith("retry:")) {
            processRetryLine(line);
        } else if (!line.startsWith(":")) {
            logger.debug("Ignoring unknown SSE field: {}", line);
        }
    }

    private void processDataLine(String line, StreamingResponseHandler<T> handler) {
        if (isCompletionLine(line)) {
            handler.onComplete();
            return;
        }

        String data = line.substring(5).trim();
        JSONObject json;
        try {
            json = new JSONObject(data);
        } catch (JSONException e) {
            logger.warn("Failed to parse SSE data line as JSON: {} - {}", data, e.getMessage());
            return;
        }

        if (!currentMetadata.isEmpty() || currentEventType != null || currentEventId != null) {
            Map<String, Object> metadata = new HashMap<>(currentMetadata);
            if (currentEventType != null) {
                metadata.put("event_type", currentEventType);
            }
            if (currentEventId != null) {
                metadata.put("event_id", currentEventId);
            }
            handler.onMetadata(metadata);
        }

        T extracted = dataExtractor.extract(json);
        if (extracted != null) {
            handler.onData(extracted);
        }
    }

    private void processRetryLine(String line) {
        try {
            currentMetadata.put("retry_ms", Integer.parseInt(line.substring(6).trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid retry value in SSE: {}", line);
        }
    }

    @Override
    public boolean isCompletionLine(String line) {
        if (!line.startsWith("data:")) {
            return false;
        }
        String data = line.substring(5).trim();
        return DONE.equals(data) || ("\"" + DONE + "\"").equals(data);
    }

    @Override
    public void reset() {
        currentEventType = null;
        currentEventId = null;
        currentMetadata.clear();
    }

    /**
     * Extracts a chunk from one JSON payload.
     *
     * @param <T> the type of chunk to extract
     */
    @FunctionalInterface
    public interface DataExtractor<T> {
        /**
         * @return the extracted chunk, or null to skip this payload
         */
        T extract(JSONObject jsonObject);
    }
}
