package de.entwicklertraining.chat.fetcher.transport;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.endpoint.ChatEndpoint;
import de.entwicklertraining.chat.fetcher.endpoint.OpenAiChatEndpoint;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetryData;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class ChatRequestTransportTest {

    private final Map<String, TelemetryData> events = new LinkedHashMap<>();
    private ScriptedFetcher fetcher;
    private ChatRequestTransport transport;
    private ChatEndpoint endpoint;

    @BeforeEach
    void setUp() {
        fetcher = new ScriptedFetcher();
        transport = new ChatRequestTransport(new FetcherService(List.of(fetcher)), events::put, "interaction-1",
                Clock.fixed(Instant.parse("2026-02-02T10:00:00Z"), ZoneOffset.UTC));
        endpoint = OpenAiChatEndpoint.builder()
                .model("gpt-test")
                .url(URI.create("http://localhost/chat/completions"))
                .supportsVision(true)
                .build();
    }

    @Test
    @DisplayName("post() sends the instrumentation headers and reports request telemetry")
    void testPostSendsHeaders() {
        fetcher.response = () -> FetchResponse.of(200, Map.of("x-request-id", "hdr-9"), "");
        JSONObject body = new JSONObject()
                .put("model", "gpt-test")
                .put("temperature", 0.1)
                .put("messages", new JSONArray().put(new JSONObject().put("role", "user").put("content", "hi")));

        FetchResponse response = transport.post(request(body, true));

        assertEquals(200, response.status());
        FetchRequest sent = fetcher.requests.get(0);
        assertEquals(URI.create("http://localhost/chat/completions"), sent.uri());
        assertEquals("Bearer secret", sent.headers().get("Authorization"));
        assertEquals("req-1", sent.headers().get("X-Request-Id"));
        assertEquals("conversation-panel", sent.headers().get("OpenAI-Intent"));
        assertEquals("interaction-1", sent.headers().get("X-Interaction-Id"));
        assertEquals("user", sent.headers().get("X-Initiator"));
        assertEquals("text/event-stream", sent.headers().get("Accept"));
        assertFalse(sent.headers().containsKey("Copilot-Vision-Request"));

        TelemetryData requestSent = events.get("request.sent");
        assertEquals("0.1", requestSent.getProperties().get("request.option.temperature"));
        assertFalse(requestSent.getProperties().containsKey("request.option.messages"));
        assertEquals("panel", requestSent.getProperties().get("messageSource"));
        assertEquals("200", events.get("request.response").getProperties().get("status"));
        assertEquals("hdr-9", events.get("request.response").getProperties().get("headerRequestId"));
    }

    @Test
    @DisplayName("Agent requests with images are flagged")
    void testVisionAndAgentHeaders() {
        fetcher.response = () -> FetchResponse.of(200, Map.of(), "");
        JSONObject image = new JSONObject().put("type", "image_url").put("image_url", new JSONObject().put("url", "data:x"));
        JSONObject body = new JSONObject().put("messages", new JSONArray()
                .put(new JSONObject().put("role", "user").put("content", new JSONArray().put(image))));

        transport.post(request(body, false));

        FetchRequest sent = fetcher.requests.get(0);
        assertEquals("agent", sent.headers().get("X-Initiator"));
        assertEquals("true", sent.headers().get("Copilot-Vision-Request"));
        assertTrue(ChatRequestTransport.containsImages(body));
    }

    @Test
    @DisplayName("Transport failures are reported and rethrown")
    void testFailureReported() {
        fetcher.response = () -> {
            throw new FetcherException.InternetDisconnectedException("offline", null);
        };

        assertThrows(FetcherException.InternetDisconnectedException.class,
                () -> transport.post(request(new JSONObject(), true)));
        assertTrue(events.containsKey("request.shownWarning"));
        assertEquals("offline", events.get("request.error").getProperties().get("error"));
    }

    @Test
    @DisplayName("Aborted requests are not reported as errors")
    void testAbortNotReported() {
        fetcher.response = () -> {
            throw new FetcherException.AbortedException("aborted", null);
        };

        assertThrows(FetcherException.AbortedException.class, () -> transport.post(request(new JSONObject(), true)));
        assertFalse(events.containsKey("request.error"));
        assertFalse(events.containsKey("request.shownWarning"));
    }

    private ChatPostRequest request(JSONObject body, boolean userInitiated) {
        return new ChatPostRequest(endpoint, "secret", "conversation-panel", "req-1", body, userInitiated, null,
                CancellationToken.none(), Map.of("messageSource", "panel"));
    }

    private static class ScriptedFetcher implements Fetcher {
        private final List<FetchRequest> requests = new ArrayList<>();
        private Supplier<FetchResponse> response;

        @Override
        public FetcherId id() {
            return FetcherId.HTTP2_CLIENT;
        }

        @Override
        public FetchResponse fetch(FetchRequest request, CancellationToken token) {
            requests.add(request);
            return response.get();
        }
    }
}
