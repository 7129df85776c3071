package de.entwicklertraining.chat.fetcher.transport;

import de.entwicklertraining.chat.fetcher.telemetry.TelemetryData;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetrySink;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends chat requests through the {@link FetcherService}, attaching the instrumentation headers
 * and reporting {@code request.*} telemetry.
 */
public class ChatRequestTransport {

    private static final Logger logger = LoggerFactory.getLogger(ChatRequestTransport.class);

    private final FetcherService fetcherService;
    private final TelemetrySink telemetry;
    private final String interactionId;
    private final Clock clock;

    public ChatRequestTransport(FetcherService fetcherService, TelemetrySink telemetry, String interactionId, Clock clock) {
        this.fetcherService = fetcherService;
        this.telemetry = telemetry;
        this.interactionId = interactionId;
        this.clock = clock;
    }

    /**
     * Posts the request and returns as soon as the response headers arrived.
     *
     * @throws FetcherException if the exchange failed or was aborted
     */
    public FetchResponse post(ChatPostRequest request) {
        Map<String, String> headers = buildHeaders(request);

        TelemetryData sent = baseTelemetry(request);
        for (String key : request.body().keySet()) {
            if (!"messages".equals(key) && !"input".equals(key)) {
                sent.property("request.option." + key, String.valueOf(request.body().get(key)));
            }
        }
        telemetry.sendEvent("request.sent", sent);

        long start = clock.millis();
        Fetcher fetcher = fetcherService.getFetcher(request.fetcherId());
        try {
            FetchResponse response = fetcher.fetch(
                    new FetchRequest(request.endpoint().getUrl(), headers, request.body().toString()), request.token());
            long totalTimeMs = clock.millis() - start;
            logger.debug("[{}] {} responded with {} after {} ms", request.requestId(), request.endpoint().getModel(),
                    response.status(), totalTimeMs);
            telemetry.sendEvent("request.response", baseTelemetry(request)
                    .property("status", String.valueOf(response.status()))
                    .property("headerRequestId", response.headers().firstValue("x-request-id").orElse(null))
                    .measurement("totalTimeMs", totalTimeMs));
            return response;
        } catch (RuntimeException e) {
            if (!fetcher.isAbortError(e)) {
                TelemetryData warning = baseTelemetry(request).property("error", e.getMessage());
                telemetry.sendEvent("request.shownWarning", warning);
                telemetry.sendEvent("request.error", baseTelemetry(request)
                        .property("error", e.getMessage())
                        .property("errorClass", e.getClass().getName())
                        .measurement("totalTimeMs", clock.millis() - start));
            }
            throw e;
        }
    }

    Map<String, String> buildHeaders(ChatPostRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + request.secretKey());
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "text/event-stream");
        headers.put("X-Request-Id", request.requestId());
        headers.put("OpenAI-Intent", request.intent());
        if (interactionId != null) {
            headers.put("X-Interaction-Id", interactionId);
        }
        headers.put("X-Initiator", request.userInitiated() ? "user" : "agent");
        if (request.endpoint().supportsVision() && containsImages(request.body())) {
            headers.put("Copilot-Vision-Request", "true");
        }
        return headers;
    }

    private TelemetryData baseTelemetry(ChatPostRequest request) {
        return TelemetryData.create(clock.instant())
                .properties(request.telemetryProperties())
                .property("endpoint", request.endpoint().getUrl().toString())
                .property("model", request.endpoint().getModel())
                .property("requestId", request.requestId());
    }

    static boolean containsImages(JSONObject body) {
        JSONArray messages = body.optJSONArray("messages");
        if (messages == null) {
            return false;
        }
        for (int i = 0; i < messages.length(); i++) {
            JSONObject message = messages.optJSONObject(i);
            JSONArray content = message != null ? message.optJSONArray("content") : null;
            if (content == null) {
                continue;
            }
            for (int j = 0; j < content.length(); j++) {
                JSONObject part = content.optJSONObject(j);
                if (part != null && "image_url".equals(part.optString("type"))) {
                    return true;
                }
            }
        }
        return false;
    }
}
