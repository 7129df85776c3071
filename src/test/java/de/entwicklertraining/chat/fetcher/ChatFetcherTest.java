package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.cancellation.CancellationTokenSource;
import de.entwicklertraining.chat.fetcher.endpoint.OpenAiChatEndpoint;
import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;
import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetryData;
import de.entwicklertraining.chat.fetcher.transport.FetchRequest;
import de.entwicklertraining.chat.fetcher.transport.FetchResponse;
import de.entwicklertraining.chat.fetcher.transport.Fetcher;
import de.entwicklertraining.chat.fetcher.transport.FetcherException;
import de.entwicklertraining.chat.fetcher.transport.FetcherId;
import de.entwicklertraining.chat.fetcher.transport.FetcherService;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link ChatFetcher} end to end against scripted transports and a real chat-completions
 * endpoint.
 */
public class ChatFetcherTest {

    private final Deque<Responder> script = new ArrayDeque<>();
    private final List<SentRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final List<String> eventNames = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, TelemetryData> lastEvents = new ConcurrentHashMap<>();
    private final List<ChatRequestCapture> captures = Collections.synchronizedList(new ArrayList<>());
    private final List<MadeChatRequestEvent> madeRequests = Collections.synchronizedList(new ArrayList<>());
    private final List<HttpHeaders> quotaHeaders = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger destroyed = new AtomicInteger();

    private FakeAuthenticationService auth;
    private OpenAiChatEndpoint endpoint;

    @BeforeEach
    void setUp() {
        auth = new FakeAuthenticationService();
        endpoint = OpenAiChatEndpoint.builder()
                .model("gpt-test")
                .url(URI.create("http://localhost/chat/completions"))
                .maxOutputTokens(1024)
                .tokenizer(messages -> 12)
                .build();
    }

    @Test
    @DisplayName("A streamed success returns the text and emits exactly one terminal event")
    void testSuccess() {
        script.add((request, token) -> sse(Map.of("x-request-id", "hdr-1", "Copilot-Edits-Session", "session-7"),
                text("Hello"), text(" world"), finish("stop"), "[DONE]"));
        List<ResponseDelta> deltas = new ArrayList<>();

        ChatFetcher fetcher = newFetcher(Platform.LINUX);
        fetcher.addChatRequestListener(madeRequests::add);
        ChatResponse response = fetcher.fetchOne(options()
                .finishedCallback((text, index, delta) -> {
                    deltas.add(delta);
                    return null;
                })
                .build());

        assertEquals(ChatFetchResponseType.SUCCESS, response.getType());
        assertEquals("Hello world", response.getValue());
        assertEquals("msg-1", response.getRequestId());
        assertEquals("hdr-1", response.getServerRequestId().orElseThrow());
        assertEquals(2, deltas.size());
        assertEquals(1, requests.size());
        assertEquals(List.of("response.success"), terminalEvents());
        assertEquals("msg-1", lastEvents.get("response.success").getProperties().get("requestId"));
        assertEquals("panel", lastEvents.get("response.success").getProperties().get("messageSource"));
        assertEquals(1, destroyed.get());

        assertEquals(1, madeRequests.size());
        assertEquals(12, madeRequests.get(0).tokenCount());
        assertEquals("session-7", auth.sessionToken);
        assertEquals(1, quotaHeaders.size());

        assertEquals(1, captures.size());
        assertEquals(ChatFetchResponseType.SUCCESS, captures.get(0).outcome());
        assertEquals("Hello world", captures.get(0).responseText());
    }

    @Test
    @DisplayName("Request options are completed with defaults before sending")
    void testPreparedOptions() {
        script.add((request, token) -> sse(Map.of(), text("ok"), finish("stop"), "[DONE]"));
        script.add((request, token) -> sse(Map.of(), text("ok"), finish("stop"), "[DONE]"));
        ChatFetcher fetcher = newFetcher(Platform.LINUX);

        fetcher.fetchOne(options().requestOptions(ChatRequestOptions.builder().n(3).prediction("").build()).build());
        fetcher.fetchOne(options().requestOptions(ChatRequestOptions.builder().temperature(0.7).prediction("int a;").build()).build());

        JSONObject first = requests.get(0).body();
        assertEquals(0.1, first.getDouble("temperature"));
        assertEquals(1.0, first.getDouble("top_p"));
        assertEquals(1024, first.getInt("max_tokens"));
        assertTrue(first.getBoolean("stream"));
        assertFalse(first.has("n"));
        assertFalse(first.has("prediction"));

        JSONObject second = requests.get(1).body();
        assertEquals(0.7, second.getDouble("temperature"));
        assertFalse(second.has("max_tokens"));
        assertEquals("int a;", second.getJSONObject("prediction").getString("content"));

        FetchRequest sent = requests.get(0).request();
        assertEquals("Bearer secret", sent.headers().get("Authorization"));
        assertEquals("msg-1", sent.headers().get("X-Request-Id"));
        assertEquals("conversation-panel", sent.headers().get("OpenAI-Intent"));
        assertEquals("interaction-1", sent.headers().get("X-Interaction-Id"));
        assertEquals("user", sent.headers().get("X-Initiator"));
    }

    @Test
    @DisplayName("An invalid payload fails without any network call")
    void testValidationFailure() {
        ChatResponse response = newFetcher(Platform.LINUX).fetchMany(
                ChatFetchOptions.builder("panel", endpoint).telemetryProperty("messageId", "msg-1").build());

        assertEquals(ChatFetchResponseType.BAD_REQUEST, response.getType());
        assertEquals("Prompt failed validation with the reason: No messages provided. Please file an issue.", response.getReason());
        assertTrue(requests.isEmpty());
        assertEquals(List.of("response.error"), terminalEvents());
        assertEquals(1, captures.size());
    }

    @Test
    @DisplayName("A token cancelled before sending returns CANCELED without a network call")
    void testCancelledBeforeFetch() {
        CancellationTokenSource source = CancellationTokenSource.create();
        source.cancel();

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().cancellationToken(source.getToken()).build());

        assertEquals(ChatFetchResponseType.CANCELED, response.getType());
        assertEquals("before fetch request", response.getReason());
        assertTrue(requests.isEmpty());
        assertEquals(List.of("response.cancelled"), terminalEvents());
        assertEquals(ChatFetchResponseType.CANCELED, captures.get(0).outcome());
    }

    @Test
    @DisplayName("A token cancelled once headers arrived destroys the response exactly once")
    void testCancelledAfterHeaders() {
        CancellationTokenSource source = CancellationTokenSource.create();
        script.add((request, token) -> {
            source.cancel();
            return sse(Map.of(), text("never read"), "[DONE]");
        });

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().cancellationToken(source.getToken()).build());

        assertEquals(ChatFetchResponseType.CANCELED, response.getType());
        assertEquals("after fetch request", response.getReason());
        assertEquals(1, destroyed.get());
        assertEquals(List.of("response.cancelled"), terminalEvents());
    }

    @Test
    @DisplayName("Cancelling while the body streams returns CANCELED")
    void testCancelledWhileStreaming() {
        CancellationTokenSource source = CancellationTokenSource.create();
        script.add((request, token) -> sse(Map.of(), text("a"), text("b"), text("c"), finish("stop"), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options()
                .cancellationToken(source.getToken())
                .finishedCallback((text, index, delta) -> {
                    source.cancel();
                    return null;
                })
                .build());

        assertEquals(ChatFetchResponseType.CANCELED, response.getType());
        assertEquals(1, destroyed.get());
        assertEquals(List.of("response.cancelled"), terminalEvents());
        assertEquals(1, captures.size());
        assertEquals(ChatFetchResponseType.CANCELED, captures.get(0).outcome());
    }

    @Test
    @DisplayName("A filtered response is retried once with the filtered text")
    void testFilterRetrySucceeds() {
        script.add((request, token) -> sse(Map.of(), text("public static void"), copyrightFilter(), "[DONE]"));
        script.add((request, token) -> sse(Map.of(), text("a different answer"), finish("stop"), "[DONE]"));
        List<ResponseDelta> deltas = Collections.synchronizedList(new ArrayList<>());

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options()
                .enableRetryOnFilter(true)
                .finishedCallback((text, index, delta) -> {
                    deltas.add(delta);
                    return null;
                })
                .build());

        assertEquals(ChatFetchResponseType.SUCCESS, response.getType());
        assertEquals("a different answer", response.getValue());
        assertEquals(2, requests.size());
        assertTrue(deltas.stream().anyMatch(d -> "copyright".equals(d.retryReason())));

        JSONObject retryBody = requests.get(1).body();
        int messageCount = retryBody.getJSONArray("messages").length();
        assertEquals(2, messageCount);
        assertTrue(retryBody.getJSONArray("messages").getJSONObject(1).getString("content")
                .contains("Here's the previous response: public static void"));
        assertEquals("agent", requests.get(1).request().headers().get("X-Initiator"));
        assertEquals(2, destroyed.get());
    }

    @Test
    @DisplayName("A retry that is filtered again ends as FILTERED after two requests")
    void testFilterRetryFails() {
        script.add((request, token) -> sse(Map.of("x-request-id", "hdr-first"), text("public static void"), copyrightFilter(), "[DONE]"));
        script.add((request, token) -> sse(Map.of(), text("public static void"), copyrightFilter(), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().enableRetryOnFilter(true).build());

        assertEquals(ChatFetchResponseType.FILTERED, response.getType());
        assertEquals("Response got filtered.", response.getReason());
        assertEquals(FilterReason.COPYRIGHT, response.getCategory().orElseThrow());
        assertEquals("hdr-first", response.getServerRequestId().orElseThrow());
        assertEquals(2, requests.size());
    }

    @Test
    @DisplayName("A retry whose token was cancelled returns without a second request")
    void testFilterRetryCancelled() {
        CancellationTokenSource source = CancellationTokenSource.create();
        script.add((request, token) -> sse(Map.of("x-request-id", "hdr-first"), text("public static void"), copyrightFilter(), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options()
                .enableRetryOnFilter(true)
                .cancellationToken(source.getToken())
                .finishedCallback((text, index, delta) -> {
                    if (delta.isRetryMarker()) {
                        source.cancel();
                    }
                    return null;
                })
                .build());

        assertEquals(ChatFetchResponseType.FILTERED, response.getType());
        assertEquals("hdr-first", response.getServerRequestId().orElseThrow());
        assertEquals(1, requests.size());
        assertEquals(List.of("response.success", "response.cancelled"), terminalEvents());
        assertEquals(1, destroyed.get());
    }

    @Test
    @DisplayName("Without filter retries a filtered response is returned directly")
    void testFilterRetryDisabled() {
        script.add((request, token) -> sse(Map.of(), text("public static void"), copyrightFilter(), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertEquals(ChatFetchResponseType.FILTERED, response.getType());
        assertEquals(1, requests.size());
        assertEquals(List.of("response.success"), terminalEvents());
    }

    @Test
    @DisplayName("402 invalidates the credential and reports the quota")
    void testQuotaExceeded() {
        script.add((request, token) -> error(402, Map.of("retry-after", "3600"), "{\"error\":{\"message\":\"Quota exhausted\"}}"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertEquals(ChatFetchResponseType.QUOTA_EXCEEDED, response.getType());
        assertEquals("Quota exhausted", response.getReason());
        assertTrue(response.getRetryAfter().isPresent());
        assertEquals(List.of(402), auth.invalidated);
        assertEquals(List.of("response.error"), terminalEvents());
        assertEquals(1, destroyed.get());
    }

    @Test
    @DisplayName("429 is a rate limit and keeps the credential")
    void testRateLimited() {
        script.add((request, token) -> error(429, Map.of("retry-after", "10", "x-ratelimit-exceeded", "chat"),
                "{\"error\":{\"code\":\"rate_limited\",\"message\":\"Too many requests\"}}"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertEquals(ChatFetchResponseType.RATE_LIMITED, response.getType());
        assertEquals("chat", response.getRateLimitKey().orElseThrow());
        assertEquals("rate_limited", response.getErrorDetails().get("code"));
        assertTrue(auth.invalidated.isEmpty());
    }

    @Test
    @DisplayName("Status mapping covers prompt filter, unsupported client and server errors")
    void testStatusMapping() {
        script.add((request, token) -> error(422, Map.of(), "{}"));
        script.add((request, token) -> error(466, Map.of(), "update required"));
        script.add((request, token) -> error(500, Map.of(), "boom"));
        script.add((request, token) -> error(499, Map.of(), ""));
        ChatFetcher fetcher = newFetcher(Platform.LINUX);

        ChatResponse promptFiltered = fetcher.fetchOne(options().build());
        ChatResponse badRequest = fetcher.fetchOne(options().build());
        ChatResponse serverError = fetcher.fetchOne(options().build());
        ChatResponse serverCanceled = fetcher.fetchOne(options().build());

        assertEquals(ChatFetchResponseType.PROMPT_FILTERED, promptFiltered.getType());
        assertEquals(FilterReason.PROMPT, promptFiltered.getCategory().orElseThrow());
        assertEquals(ChatFetchResponseType.BAD_REQUEST, badRequest.getType());
        assertEquals(ChatFetchResponseType.SERVER_ERROR, serverError.getType());
        assertEquals("Server error: 500", serverError.getReason());
        assertEquals(ChatFetchResponseType.FAILED, serverCanceled.getType());
        assertEquals(4, requests.size());
    }

    @Test
    @DisplayName("On Linux a network change is retried once through the alternate fetcher")
    void testNetworkChangedRetry() {
        script.add((request, token) -> {
            throw new FetcherException.NetworkChangedException("net::ERR_NETWORK_CHANGED", null);
        });
        script.add((request, token) -> sse(Map.of(), text("recovered"), finish("stop"), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().enableRetryOnError(true).build());

        assertEquals(ChatFetchResponseType.SUCCESS, response.getType());
        assertEquals("recovered", response.getValue());
        assertEquals(List.of(FetcherId.HTTP2_CLIENT, FetcherId.HTTP1_CLIENT),
                requests.stream().map(SentRequest::fetcherId).collect(Collectors.toList()));
        assertEquals(List.of("response.error", "response.success"), terminalEvents());
    }

    @Test
    @DisplayName("On Windows a network change is reported without retry")
    void testNetworkChangedOnWindows() {
        script.add((request, token) -> {
            throw new FetcherException.NetworkChangedException("net::ERR_NETWORK_CHANGED", null);
        });

        ChatResponse response = newFetcher(Platform.WINDOWS).fetchOne(options().enableRetryOnError(true).build());

        assertEquals(ChatFetchResponseType.NETWORK_ERROR, response.getType());
        assertTrue(response.getReason().startsWith("Please check your firewall rules and network connection"));
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("A disconnected network gets a dedicated message")
    void testInternetDisconnected() {
        script.add((request, token) -> {
            throw new FetcherException.InternetDisconnectedException("getaddrinfo ENOTFOUND", null);
        });

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertEquals(ChatFetchResponseType.NETWORK_ERROR, response.getType());
        assertEquals("It appears you're not connected to the internet, please check your network connection and try again.",
                response.getReason());
        assertTrue(response.getReasonDetail().orElseThrow().contains("getaddrinfo ENOTFOUND"));
    }

    @Test
    @DisplayName("An aborted exchange is a cancellation")
    void testAborted() {
        script.add((request, token) -> {
            throw new FetcherException.AbortedException("aborted", null);
        });

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertEquals(ChatFetchResponseType.CANCELED, response.getType());
        assertEquals("network request aborted", response.getReason());
        assertEquals(List.of("response.cancelled"), terminalEvents());
    }

    @Test
    @DisplayName("A missing credential fails before sending and an explicit key wins")
    void testCredentialResolution() {
        auth.token = null;
        script.add((request, token) -> sse(Map.of(), text("ok"), finish("stop"), "[DONE]"));
        ChatFetcher fetcher = newFetcher(Platform.LINUX);

        ChatResponse missing = fetcher.fetchOne(options().build());
        ChatResponse explicit = fetcher.fetchOne(options()
                .requestOptions(ChatRequestOptions.builder().secretKey("override").build())
                .build());

        assertEquals(ChatFetchResponseType.TOKEN_EXPIRED_OR_INVALID, missing.getType());
        assertEquals("key is missing", missing.getReason());
        assertEquals(ChatFetchResponseType.SUCCESS, explicit.getType());
        assertEquals(1, requests.size());
        assertEquals("Bearer override", requests.get(0).request().headers().get("Authorization"));
    }

    @Test
    @DisplayName("An exhausted quota flag drops the credential even on success")
    void testQuotaFlagOnSuccess() {
        auth.quotaExceeded = true;
        script.add((request, token) -> sse(Map.of(), text("ok"), finish("stop"), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options().build());

        assertTrue(response.isSuccess());
        assertEquals(List.of(200), auth.invalidated);
    }

    @Test
    @DisplayName("A failing callback ends the request as FAILED")
    void testCallbackFailure() {
        script.add((request, token) -> sse(Map.of(), text("a"), finish("stop"), "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX).fetchOne(options()
                .finishedCallback((text, index, delta) -> {
                    throw new IllegalStateException("renderer crashed");
                })
                .build());

        assertEquals(ChatFetchResponseType.FAILED, response.getType());
        assertEquals("Error on conversation request. Check the log for more details.", response.getReason());
        assertEquals(1, destroyed.get());
    }

    @Test
    @Timeout(10)
    @DisplayName("fetchManyAsync() returns every candidate")
    void testFetchManyAsync() throws Exception {
        script.add((request, token) -> sse(Map.of(),
                "{\"choices\":[{\"index\":0,\"delta\":{\"content\":\"A\"}},{\"index\":1,\"delta\":{\"content\":\"B\"}}]}",
                "{\"choices\":[{\"index\":0,\"finish_reason\":\"stop\"},{\"index\":1,\"finish_reason\":\"stop\"}]}",
                "[DONE]"));

        ChatResponse response = newFetcher(Platform.LINUX)
                .fetchManyAsync(options().requestOptions(ChatRequestOptions.builder().n(2).build()).build())
                .get(5, TimeUnit.SECONDS);

        assertEquals(List.of("A", "B"), response.getValues());
        assertTrue(response.getUsage().isEmpty());
        assertEquals(2, requests.get(0).body().getInt("n"));
    }

    private ChatFetcher newFetcher(Platform platform) {
        FetcherService fetcherService = new FetcherService(List.of(
                new ScriptedFetcher(FetcherId.HTTP2_CLIENT), new ScriptedFetcher(FetcherId.HTTP1_CLIENT)));
        return ChatFetcher.builder()
                .settings(ChatFetcherSettings.builder()
                        .platform(platform)
                        .interactionId("interaction-1")
                        .build())
                .fetcherService(fetcherService)
                .authenticationService(auth)
                .quotaService(quotaHeaders::add)
                .requestLogger(new CapturingRequestLogger(captures::add, Clock.systemUTC()))
                .telemetrySink((name, data) -> {
                    eventNames.add(name);
                    lastEvents.put(name, data);
                })
                .build();
    }

    private ChatFetchOptions.Builder options() {
        return ChatFetchOptions.builder("panel", endpoint)
                .messages(List.of(ChatMessage.user("How do I sort a list?")))
                .location(ChatLocation.PANEL)
                .userInitiatedRequest(true)
                .telemetryProperty("messageId", "msg-1");
    }

    private List<String> terminalEvents() {
        synchronized (eventNames) {
            return eventNames.stream().filter(name -> name.startsWith("response.")).collect(Collectors.toList());
        }
    }

    private FetchResponse sse(Map<String, String> headers, String... payloads) {
        StringBuilder body = new StringBuilder();
        for (String payload : payloads) {
            body.append("data: ").append(payload).append("\n\n");
        }
        return error(200, headers, body.toString());
    }

    private FetchResponse error(int status, Map<String, String> headers, String body) {
        return new FetchResponse(status, FetchResponse.headersOf(headers),
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), destroyed::incrementAndGet);
    }

    private static String text(String content) {
        return new JSONObject().put("choices", List.of(Map.of("index", 0, "delta", Map.of("content", content)))).toString();
    }

    private static String finish(String reason) {
        return "{\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"" + reason + "\"}]}";
    }

    private static String copyrightFilter() {
        return "{\"choices\":[{\"index\":0,\"finish_reason\":\"content_filter\","
                + "\"content_filter_results\":{\"protected_material_code\":{\"filtered\":true,\"detected\":true}}}]}";
    }

    @FunctionalInterface
    private interface Responder {
        FetchResponse respond(FetchRequest request, CancellationToken token);
    }

    private record SentRequest(FetcherId fetcherId, FetchRequest request) {
        JSONObject body() {
            return new JSONObject(request.body());
        }
    }

    private class ScriptedFetcher implements Fetcher {
        private final FetcherId id;

        ScriptedFetcher(FetcherId id) {
            this.id = id;
        }

        @Override
        public FetcherId id() {
            return id;
        }

        @Override
        public FetchResponse fetch(FetchRequest request, CancellationToken token) {
            requests.add(new SentRequest(id, request));
            Responder responder;
            synchronized (script) {
                responder = script.poll();
            }
            if (responder == null) {
                throw new IllegalStateException("No scripted response left for request " + requests.size());
            }
            return responder.respond(request, token);
        }
    }

    private static class FakeAuthenticationService implements AuthenticationService {
        private volatile String token = "secret";
        private volatile boolean quotaExceeded;
        private volatile String sessionToken;
        private final List<Integer> invalidated = Collections.synchronizedList(new ArrayList<>());

        @Override
        public Optional<String> getCurrentToken() {
            return Optional.ofNullable(token);
        }

        @Override
        public void invalidateToken(int status) {
            invalidated.add(status);
        }

        @Override
        public boolean isChatQuotaExceeded() {
            return quotaExceeded;
        }

        @Override
        public void setSessionContinuationToken(String token) {
            sessionToken = token;
        }
    }
}
