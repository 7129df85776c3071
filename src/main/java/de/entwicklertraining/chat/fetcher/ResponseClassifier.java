package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ModelRequestId;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps a non-2xx provider response to a {@link ChatRequestFailure}.
 *
 * <p>Classification depends only on the status code, the body text and the headers, plus the
 * injected clock for relative {@code retry-after} values. It has no side effects; credential
 * invalidation is left to the caller via {@link ChatFailKind#invalidatesCredential()}.
 */
public class ResponseClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ResponseClassifier.class);

    private final Clock clock;

    public ResponseClassifier(Clock clock) {
        this.clock = clock;
    }

    public ChatRequestFailure classify(int status, String text, HttpHeaders headers) {
        String body = text != null ? text : "";
        JSONObject json = parseErrorObject(body);
        ModelRequestId requestId = ModelRequestId.fromHeaders(headers);
        Map<String, Object> details = json != null ? Collections.unmodifiableMap(new HashMap<>(json.toMap())) : Map.of();
        String code = json != null ? json.optString("code", null) : null;
        String message = json != null ? json.optString("message", null) : null;

        if (status >= 400 && status < 500) {
            if (status == 400 && body.contains("off_topic")) {
                return failure(status, ChatFailKind.OFF_TOPIC,
                        "filtered as off_topic by intent classifier: message was not programming related", requestId, details);
            }
            if (status == 401 && json != null && json.has("authorize_url")) {
                return new ChatRequestFailure(status, ChatFailKind.AGENT_UNAUTHORIZED, "Unauthorized", requestId,
                        null, null, json.optString("authorize_url"), details);
            }
            if (status == 400 && "previous_response_not_found".equals(code)) {
                return failure(status, ChatFailKind.INVALID_PREVIOUS_RESPONSE_ID,
                        message != null ? message : "Invalid previous response ID", requestId, details);
            }
            if (status == 401 || status == 403) {
                return failure(status, ChatFailKind.TOKEN_EXPIRED_OR_INVALID,
                        message != null ? message : "token expired or invalid: " + status, requestId, details);
            }
            if (status == 402) {
                return new ChatRequestFailure(status, ChatFailKind.QUOTA_EXCEEDED,
                        message != null ? message : "Free tier quota exceeded", requestId,
                        parseRetryAfter(headers.firstValue("retry-after").orElse(null)), null, null, details);
            }
            if (status == 404) {
                return failure(status, ChatFailKind.NOT_FOUND, json != null ? json.toString() : body, requestId, details);
            }
            if (status == 422) {
                return failure(status, ChatFailKind.CONTENT_FILTER, "Filtered by Responsible AI Service", requestId, details);
            }
            if (status == 424) {
                return failure(status, ChatFailKind.AGENT_FAILED_DEPENDENCY, body, requestId, details);
            }
            if (status == 429) {
                Instant retryAfter = parseRetryAfter(headers.firstValue("retry-after").orElse(null));
                if ("extension_blocked".equals(code)) {
                    return new ChatRequestFailure(status, ChatFailKind.EXTENSION_BLOCKED, "Extension blocked", requestId,
                            retryAfter, null, null, details);
                }
                String reason = message != null ? message : code != null ? code : body;
                return new ChatRequestFailure(status, ChatFailKind.RATE_LIMITED, reason, requestId,
                        retryAfter, headers.firstValue("x-ratelimit-exceeded").orElse(null), null, details);
            }
            if (status == 466) {
                logger.info("Client not supported: {}", body);
                return failure(status, ChatFailKind.CLIENT_NOT_SUPPORTED, "client not supported: " + body, requestId, details);
            }
            if (status == 499) {
                logger.info("Request was cancelled by the server");
                return failure(status, ChatFailKind.SERVER_CANCELED, "canceled by server", requestId, details);
            }
        } else if (status >= 500 && status < 600) {
            if (status == 503) {
                Map<String, Object> upstream = new HashMap<>();
                upstream.put("code", "upstream_provider_rate_limit");
                upstream.put("message", body);
                return failure(status, ChatFailKind.RATE_LIMITED, "Upstream provider rate limit hit", requestId,
                        Collections.unmodifiableMap(upstream));
            }
            String reason = "Server error: " + status;
            logger.error("{} {}", reason, body);
            return failure(status, ChatFailKind.SERVER_ERROR, reason, requestId, details);
        }

        logger.error("Request Failed: {} {}", status, body);
        return failure(status, ChatFailKind.UNKNOWN, "Request Failed: " + status + " " + body, requestId, details);
    }

    /**
     * Parses a {@code retry-after} header given either as an HTTP date or as a number of seconds.
     *
     * @return the instant after which a retry is allowed, or null if the value is absent or malformed
     */
    public Instant parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // not an HTTP date
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            // not an ISO instant
        }
        try {
            return clock.instant().plusSeconds(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed retry-after value: {}", trimmed);
            return null;
        }
    }

    private static ChatRequestFailure failure(int status, ChatFailKind kind, String reason, ModelRequestId requestId,
                                              Map<String, Object> details) {
        return new ChatRequestFailure(status, kind, reason, requestId, null, null, null, details);
    }

    // the provider nests the interesting part under "error" when present
    private static JSONObject parseErrorObject(String body) {
        try {
            JSONObject parsed = new JSONObject(body);
            JSONObject nested = parsed.optJSONObject("error");
            return nested != null ? nested : parsed;
        } catch (JSONException e) {
            return null;
        }
    }
}
