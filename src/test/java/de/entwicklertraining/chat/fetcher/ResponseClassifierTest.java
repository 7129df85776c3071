package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.transport.FetchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseClassifierTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private ResponseClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ResponseClassifier(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("400 mentioning off_topic is classified as off topic")
    void testOffTopic() {
        ChatRequestFailure failure = classify(400, "{\"error\":{\"code\":\"off_topic\"}}");

        assertEquals(ChatFailKind.OFF_TOPIC, failure.kind());
    }

    @Test
    @DisplayName("401 with authorize_url asks the user to authorize the agent")
    void testAgentUnauthorized() {
        ChatRequestFailure failure = classify(401, "{\"authorize_url\":\"https://example.com/authorize\"}");

        assertEquals(ChatFailKind.AGENT_UNAUTHORIZED, failure.kind());
        assertEquals("Unauthorized", failure.reason());
        assertEquals("https://example.com/authorize", failure.authorizeUrl());
    }

    @Test
    @DisplayName("Unknown previous response id is classified separately")
    void testInvalidPreviousResponseId() {
        ChatRequestFailure failure = classify(400,
                "{\"error\":{\"code\":\"previous_response_not_found\",\"message\":\"Response resp_1 not found\"}}");

        assertEquals(ChatFailKind.INVALID_PREVIOUS_RESPONSE_ID, failure.kind());
        assertEquals("Response resp_1 not found", failure.reason());
    }

    @Test
    @DisplayName("401 and 403 invalidate the credential")
    void testTokenExpired() {
        ChatRequestFailure unauthorized = classify(401, "expired");
        ChatRequestFailure forbidden = classify(403, "{\"message\":\"not allowed\"}");

        assertEquals(ChatFailKind.TOKEN_EXPIRED_OR_INVALID, unauthorized.kind());
        assertEquals("token expired or invalid: 401", unauthorized.reason());
        assertTrue(unauthorized.kind().invalidatesCredential());
        assertEquals("not allowed", forbidden.reason());
    }

    @Test
    @DisplayName("402 carries a relative retry-after")
    void testQuotaExceededWithSeconds() {
        ChatRequestFailure failure = classifier.classify(402, "not json", headers(Map.of("retry-after", "120")));

        assertEquals(ChatFailKind.QUOTA_EXCEEDED, failure.kind());
        assertEquals("Free tier quota exceeded", failure.reason());
        assertEquals(NOW.plusSeconds(120), failure.retryAfter());
        assertTrue(failure.kind().invalidatesCredential());
    }

    @Test
    @DisplayName("402 carries an HTTP-date retry-after")
    void testQuotaExceededWithDate() {
        ChatRequestFailure failure = classifier.classify(402, "{\"message\":\"Monthly quota reached\"}",
                headers(Map.of("retry-after", "Wed, 21 Oct 2026 07:28:00 GMT")));

        assertEquals("Monthly quota reached", failure.reason());
        assertEquals(Instant.parse("2026-10-21T07:28:00Z"), failure.retryAfter());
    }

    @Test
    @DisplayName("404, 422 and 424 map to their own kinds")
    void testNotFoundContentFilterAndDependency() {
        ChatRequestFailure notFound = classify(404, "no such model");
        ChatRequestFailure filtered = classify(422, "{}");
        ChatRequestFailure dependency = classify(424, "agent down");

        assertEquals(ChatFailKind.NOT_FOUND, notFound.kind());
        assertEquals("no such model", notFound.reason());
        assertEquals(ChatFailKind.CONTENT_FILTER, filtered.kind());
        assertEquals("Filtered by Responsible AI Service", filtered.reason());
        assertEquals(ChatFailKind.AGENT_FAILED_DEPENDENCY, dependency.kind());
        assertEquals("agent down", dependency.reason());
    }

    @Test
    @DisplayName("429 with extension_blocked is not a rate limit")
    void testExtensionBlocked() {
        ChatRequestFailure failure = classifier.classify(429,
                "{\"error\":{\"code\":\"extension_blocked\",\"message\":\"blocked\"}}",
                headers(Map.of("retry-after", "60")));

        assertEquals(ChatFailKind.EXTENSION_BLOCKED, failure.kind());
        assertEquals("Extension blocked", failure.reason());
        assertEquals(NOW.plusSeconds(60), failure.retryAfter());
    }

    @Test
    @DisplayName("429 reports the rate limit key and the provider's error object")
    void testRateLimited() {
        ChatRequestFailure failure = classifier.classify(429,
                "{\"error\":{\"code\":\"rate_limited\",\"message\":\"Slow down\"}}",
                headers(Map.of("retry-after", "5", "x-ratelimit-exceeded", "global-chat", "x-request-id", "req-1")));

        assertEquals(ChatFailKind.RATE_LIMITED, failure.kind());
        assertEquals("Slow down", failure.reason());
        assertEquals("global-chat", failure.rateLimitKey());
        assertEquals(NOW.plusSeconds(5), failure.retryAfter());
        assertEquals("rate_limited", failure.errorDetails().get("code"));
        assertEquals("req-1", failure.requestId().headerRequestId());
    }

    @Test
    @DisplayName("466 and 499 are client-not-supported and server-canceled")
    void testClientNotSupportedAndServerCanceled() {
        ChatRequestFailure notSupported = classify(466, "upgrade required");
        ChatRequestFailure canceled = classify(499, "");

        assertEquals(ChatFailKind.CLIENT_NOT_SUPPORTED, notSupported.kind());
        assertEquals("client not supported: upgrade required", notSupported.reason());
        assertEquals(ChatFailKind.SERVER_CANCELED, canceled.kind());
        assertEquals("canceled by server", canceled.reason());
    }

    @Test
    @DisplayName("503 is an upstream rate limit, other 5xx are server errors")
    void testServerErrors() {
        ChatRequestFailure upstream = classify(503, "overloaded");
        ChatRequestFailure server = classify(500, "oops");

        assertEquals(ChatFailKind.RATE_LIMITED, upstream.kind());
        assertEquals("Upstream provider rate limit hit", upstream.reason());
        assertEquals("upstream_provider_rate_limit", upstream.errorDetails().get("code"));
        assertEquals("overloaded", upstream.errorDetails().get("message"));
        assertEquals(ChatFailKind.SERVER_ERROR, server.kind());
        assertEquals("Server error: 500", server.reason());
    }

    @Test
    @DisplayName("Unmatched statuses are unknown failures")
    void testUnknown() {
        ChatRequestFailure redirect = classify(302, "moved");
        ChatRequestFailure teapot = classify(418, "teapot");

        assertEquals(ChatFailKind.UNKNOWN, redirect.kind());
        assertEquals("Request Failed: 302 moved", redirect.reason());
        assertEquals(ChatFailKind.UNKNOWN, teapot.kind());
        assertTrue(redirect.errorDetails().isEmpty());
    }

    @Test
    @DisplayName("Classification is deterministic for the same input")
    void testDeterministic() {
        HttpHeaders headers = headers(Map.of("retry-after", "30"));
        String body = "{\"error\":{\"message\":\"Too many requests\"}}";

        assertEquals(classifier.classify(429, body, headers), classifier.classify(429, body, headers));
    }

    @Test
    @DisplayName("Malformed retry-after values are ignored")
    void testMalformedRetryAfter() {
        assertNull(classifier.parseRetryAfter("soon"));
        assertNull(classifier.parseRetryAfter(null));
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), classifier.parseRetryAfter("2026-03-01T10:00:00Z"));
    }

    private ChatRequestFailure classify(int status, String body) {
        return classifier.classify(status, body, headers(Map.of()));
    }

    private static HttpHeaders headers(Map<String, String> values) {
        return FetchResponse.headersOf(values);
    }
}
