package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.RequestLogger.PendingLoggedChatRequest;
import de.entwicklertraining.chat.fetcher.cancellation.CancellationException;
import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.endpoint.ChatEndpoint;
import de.entwicklertraining.chat.fetcher.endpoint.ChatEndpointRequest;
import de.entwicklertraining.chat.fetcher.endpoint.Tokenizer;
import de.entwicklertraining.chat.fetcher.model.ChatCompletion;
import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;
import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.repetition.RepetitionDetector;
import de.entwicklertraining.chat.fetcher.repetition.TokenRepetitionDetector;
import de.entwicklertraining.chat.fetcher.telemetry.SafeTelemetrySink;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetryData;
import de.entwicklertraining.chat.fetcher.telemetry.TelemetrySink;
import de.entwicklertraining.chat.fetcher.transport.ChatPostRequest;
import de.entwicklertraining.chat.fetcher.transport.ChatRequestTransport;
import de.entwicklertraining.chat.fetcher.transport.FetchResponse;
import de.entwicklertraining.chat.fetcher.transport.FetcherHttpConfiguration;
import de.entwicklertraining.chat.fetcher.transport.FetcherService;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Sends chat requests to a completion provider and turns every outcome into a typed
 * {@link ChatResponse}.
 *
 * <p>A call runs through these stages:
 * <ol>
 *   <li>the request options are completed with defaults and the payload is validated; an invalid
 *       payload ends as {@code BAD_REQUEST} without any network traffic</li>
 *   <li>the request is posted; cancellation is checked before sending and again once the headers
 *       arrived</li>
 *   <li>a 2xx body is streamed through the endpoint and the candidates are reduced to one response;
 *       any other status is classified by the {@link ResponseClassifier}</li>
 *   <li>a content-filtered response or a network-changed transport failure may be retried once,
 *       through a nested call with the triggering retry flag cleared</li>
 * </ol>
 *
 * <p>Expected failures are returned, never thrown. Every call emits exactly one of the
 * {@code response.success}, {@code response.error} or {@code response.cancelled} telemetry events
 * and resolves its request log entry once.
 *
 * <p>Example usage:
 * <pre>
 * ChatFetcher fetcher = ChatFetcher.builder()
 *     .authenticationService(auth)
 *     .telemetrySink(telemetry)
 *     .build();
 *
 * ChatResponse response = fetcher.fetchOne(ChatFetchOptions.builder("panel-chat", endpoint)
 *     .messages(List.of(ChatMessage.user("Explain this stack trace")))
 *     .enableRetryOnFilter(true)
 *     .build());
 * </pre>
 */
public class ChatFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ChatFetcher.class);

    private static final ExecutorService ASYNC_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "chat-fetcher-async");
        thread.setDaemon(true);
        return thread;
    });

    static final long DEFAULT_EXTENSION_BLOCKED_RETRY_SECONDS = 300;

    private final ChatFetcherSettings settings;
    private final Clock clock;
    private final FetcherService fetcherService;
    private final ChatRequestTransport transport;
    private final AuthenticationService authenticationService;
    private final ChatQuotaService quotaService;
    private final RequestLogger requestLogger;
    private final TelemetrySink telemetry;
    private final PayloadValidator validator;
    private final ResponseClassifier classifier;
    private final CompletionSelector selector;
    private final RetryCoordinator retryCoordinator;
    private final List<Consumer<MadeChatRequestEvent>> chatRequestListeners = new CopyOnWriteArrayList<>();

    private ChatFetcher(Builder builder) {
        this.settings = builder.settings;
        this.clock = settings.getClock();
        this.fetcherService = builder.fetcherService != null
                ? builder.fetcherService
                : FetcherService.createDefault(FetcherHttpConfiguration.defaults());
        this.authenticationService = Objects.requireNonNull(builder.authenticationService, "authenticationService");
        this.quotaService = builder.quotaService;
        this.requestLogger = builder.requestLogger;
        this.telemetry = SafeTelemetrySink.wrap(builder.telemetrySink);
        this.transport = new ChatRequestTransport(fetcherService, telemetry, settings.getInteractionId(), clock);
        this.validator = new PayloadValidator(settings.getHardToolLimit());
        this.classifier = new ResponseClassifier(clock);
        this.selector = new CompletionSelector(builder.repetitionDetector, telemetry);
        this.retryCoordinator = new RetryCoordinator(fetcherService, settings.getPlatform());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a listener notified after every request that reached the provider.
     */
    public void addChatRequestListener(Consumer<MadeChatRequestEvent> listener) {
        chatRequestListeners.add(listener);
    }

    public void removeChatRequestListener(Consumer<MadeChatRequestEvent> listener) {
        chatRequestListeners.remove(listener);
    }

    /**
     * Requests a single candidate. On success {@link ChatResponse#getValue()} holds its text.
     */
    public ChatResponse fetchOne(ChatFetchOptions options) {
        return fetch(options, 1);
    }

    /**
     * Requests as many candidates as the request options ask for.
     */
    public ChatResponse fetchMany(ChatFetchOptions options) {
        return fetch(options, null);
    }

    public CompletableFuture<ChatResponse> fetchOneAsync(ChatFetchOptions options) {
        return CompletableFuture.supplyAsync(() -> fetchOne(options), ASYNC_EXECUTOR);
    }

    public CompletableFuture<ChatResponse> fetchManyAsync(ChatFetchOptions options) {
        return CompletableFuture.supplyAsync(() -> fetchMany(options), ASYNC_EXECUTOR);
    }

    private ChatResponse fetch(ChatFetchOptions options, Integer forcedN) {
        ChatEndpoint endpoint = options.getEndpoint();
        Map<String, String> telemetryProperties = options.getTelemetryProperties();
        String requestId = resolveRequestId(telemetryProperties);
        telemetryProperties.putIfAbsent("messageSource", options.getDebugName());

        CallContext call = new CallContext(options, requestId, prepareOptions(options.getRequestOptions(), endpoint, forcedN),
                new FetchStreamRecorder(options.getFinishedCallback().orElse(null), clock), clock.millis(), forcedN);

        ValidationResult validation = validator.validate(options.getMessages(), call.postOptions);
        if (!validation.valid()) {
            logger.warn("[{}] Request '{}' failed validation: {}", requestId, options.getDebugName(), validation.reason());
            ChatResponse invalid = ChatResponse.builder(ChatFetchResponseType.BAD_REQUEST, requestId)
                    .reason(validation.reason())
                    .build();
            requestLogger.begin(options.getDebugName(), endpoint.getModel(), null).resolve(invalid, List.of());
            sendResponseError(call, invalid);
            return invalid;
        }

        JSONObject body = endpoint.createRequestBody(new ChatEndpointRequest(options.getDebugName(),
                options.getMessages(), call.postOptions, options.isIgnoreStatefulMarker()));
        PendingLoggedChatRequest pending = requestLogger.begin(options.getDebugName(), endpoint.getModel(), body);

        ChatResponse result;
        try {
            result = fetchAndStream(call, body, pending);
        } catch (RuntimeException e) {
            return handleError(call, e, pending);
        }

        if (result.getType() == ChatFetchResponseType.FILTERED_RETRY) {
            return handleFilteredRetry(call, result, pending);
        }
        resolve(pending, result, call.recorder);
        return result;
    }

    private ChatResponse fetchAndStream(CallContext call, JSONObject body, PendingLoggedChatRequest pending) {
        ChatFetchOptions options = call.options;
        ChatEndpoint endpoint = options.getEndpoint();
        CancellationToken token = options.getCancellationToken();

        if (token.isCancelled()) {
            return canceled(call, "before fetch request");
        }

        Optional<String> secretKey = call.postOptions.getSecretKey()
                .or(authenticationService::getCurrentToken)
                .filter(key -> !key.isBlank());
        if (secretKey.isEmpty()) {
            logger.error("[{}] No credential available for '{}'", call.requestId, options.getDebugName());
            ChatResponse missingKey = ChatResponse.builder(ChatFetchResponseType.TOKEN_EXPIRED_OR_INVALID, call.requestId)
                    .reason("key is missing")
                    .build();
            sendResponseError(call, missingKey);
            return missingKey;
        }

        int tokenCount = countTokens(endpoint, options.getMessages());
        logger.debug("[{}] Sending '{}' to {} ({} prompt tokens)", call.requestId, options.getDebugName(),
                endpoint.getModel(), tokenCount);

        FetchResponse response = transport.post(new ChatPostRequest(endpoint, secretKey.get(),
                options.getLocation().toIntent(), call.requestId, body, options.isUserInitiatedRequest(),
                options.getUseFetcher().orElse(null), token, Map.copyOf(options.getTelemetryProperties())));
        try {
            publish(new MadeChatRequestEvent(options.getMessages(), endpoint.getModel(), tokenCount));
            pending.markTimeToFirstToken(clock.millis() - call.issuedTime);

            if (token.isCancelled()) {
                return canceled(call, "after fetch request");
            }

            if (response.status() == 200) {
                onSuccessHeaders(response);
                List<ChatCompletion> completions = endpoint.processResponse(response,
                        call.postOptions.getN(), call.recorder, token);
                ChatResponse result = selector.select(completions, call.requestId, options.getTelemetryProperties());
                sendTerminal("response.success", call, result, tokenCount);
                return result;
            }

            ChatRequestFailure failure = classifier.classify(response.status(), response.text(), response.headers());
            if (failure.kind().invalidatesCredential()) {
                authenticationService.invalidateToken(response.status());
            }
            ChatResponse result = toResponse(failure, call.requestId);
            logger.info("[{}] Request '{}' failed with {}: {} (server request id {})", call.requestId,
                    options.getDebugName(), response.status(), failure.reason(), failure.requestId().serverRequestId());
            sendResponseError(call, result);
            return result;
        } finally {
            response.destroy();
        }
    }

    private void onSuccessHeaders(FetchResponse response) {
        if (authenticationService.isChatQuotaExceeded()) {
            // the cached credential still reports an exhausted quota although the call went through
            authenticationService.invalidateToken(response.status());
        }
        quotaService.processQuotaHeaders(response.headers());
        response.headers().firstValue("Copilot-Edits-Session")
                .ifPresent(authenticationService::setSessionContinuationToken);
    }

    private ChatResponse handleFilteredRetry(CallContext call, ChatResponse filteredRetry, PendingLoggedChatRequest pending) {
        Optional<ChatFetchOptions> retry = retryCoordinator.filterRetryFor(call.options, filteredRetry);
        if (retry.isPresent()) {
            call.recorder.markRetry(filteredRetry.getCategory().map(FilterReason::wireName).orElse("uncategorized"));
            ChatResponse retryResult = fetch(retry.get(), call.forcedN);
            resolve(pending, retryResult, call.recorder);
            if (retryResult.isSuccess()) {
                return retryResult;
            }
        }

        ChatResponse filtered = ChatResponse.builder(ChatFetchResponseType.FILTERED, call.requestId)
                .serverRequestId(filteredRetry.getServerRequestId().orElse(null))
                .category(filteredRetry.getCategory().orElse(null))
                .reason("Response got filtered.")
                .build();
        if (retry.isEmpty()) {
            resolve(pending, filtered, call.recorder);
        }
        return filtered;
    }

    private ChatResponse handleError(CallContext call, RuntimeException error, PendingLoggedChatRequest pending) {
        ChatResponse processed = processError(error, call.requestId);
        if (processed.getType() == ChatFetchResponseType.CANCELED) {
            sendCancelled(call);
            pending.resolveCancelled();
            return processed;
        }

        sendResponseError(call, processed);
        Optional<ChatFetchOptions> retry = retryCoordinator.networkChangedRetryFor(call.options, error);
        if (retry.isPresent()) {
            call.recorder.markRetry("network_error");
            ChatResponse retryResult = fetch(retry.get(), call.forcedN);
            resolve(pending, retryResult, call.recorder);
            return retryResult;
        }
        resolve(pending, processed, call.recorder);
        return processed;
    }

    private ChatResponse processError(RuntimeException error, String requestId) {
        if (fetcherService.isAbortError(error)) {
            return ChatResponse.builder(ChatFetchResponseType.CANCELED, requestId)
                    .reason("network request aborted")
                    .build();
        }
        if (error instanceof CancellationException) {
            return ChatResponse.builder(ChatFetchResponseType.CANCELED, requestId)
                    .reason("Got a cancellation error")
                    .build();
        }
        if (fetcherService.isPrematureCloseError(error)) {
            return ChatResponse.builder(ChatFetchResponseType.CANCELED, requestId)
                    .reason("Stream closed prematurely")
                    .build();
        }

        logger.error("[{}] Error on conversation request", requestId, error);
        String detail = fetcherService.getUserMessageForFetcherError(error);
        if (fetcherService.isInternetDisconnectedError(error)) {
            return ChatResponse.builder(ChatFetchResponseType.NETWORK_ERROR, requestId)
                    .reason("It appears you're not connected to the internet, please check your network connection and try again.")
                    .reasonDetail(detail)
                    .build();
        }
        if (fetcherService.isFetcherError(error)) {
            return ChatResponse.builder(ChatFetchResponseType.NETWORK_ERROR, requestId)
                    .reason(detail)
                    .reasonDetail(detail)
                    .build();
        }
        return ChatResponse.builder(ChatFetchResponseType.FAILED, requestId)
                .reason("Error on conversation request. Check the log for more details.")
                .reasonDetail(detail)
                .build();
    }

    ChatResponse toResponse(ChatRequestFailure failure, String requestId) {
        ChatResponse.Builder builder = switch (failure.kind()) {
            case RATE_LIMITED -> ChatResponse.builder(ChatFetchResponseType.RATE_LIMITED, requestId)
                    .retryAfter(failure.retryAfter())
                    .rateLimitKey(failure.rateLimitKey() != null ? failure.rateLimitKey() : "");
            case QUOTA_EXCEEDED -> ChatResponse.builder(ChatFetchResponseType.QUOTA_EXCEEDED, requestId)
                    .retryAfter(failure.retryAfter());
            case OFF_TOPIC -> ChatResponse.builder(ChatFetchResponseType.OFF_TOPIC, requestId);
            case TOKEN_EXPIRED_OR_INVALID -> ChatResponse.builder(ChatFetchResponseType.TOKEN_EXPIRED_OR_INVALID, requestId);
            case CLIENT_NOT_SUPPORTED -> ChatResponse.builder(ChatFetchResponseType.BAD_REQUEST, requestId);
            case SERVER_ERROR -> ChatResponse.builder(ChatFetchResponseType.SERVER_ERROR, requestId);
            case CONTENT_FILTER -> ChatResponse.builder(ChatFetchResponseType.PROMPT_FILTERED, requestId)
                    .category(FilterReason.PROMPT);
            case AGENT_UNAUTHORIZED -> ChatResponse.builder(ChatFetchResponseType.AGENT_UNAUTHORIZED, requestId)
                    .authorizationUrl(failure.authorizeUrl());
            case AGENT_FAILED_DEPENDENCY -> ChatResponse.builder(ChatFetchResponseType.AGENT_FAILED_DEPENDENCY, requestId);
            case EXTENSION_BLOCKED -> ChatResponse.builder(ChatFetchResponseType.EXTENSION_BLOCKED, requestId)
                    .retryAfter(failure.retryAfter() != null
                            ? failure.retryAfter()
                            : clock.instant().plusSeconds(DEFAULT_EXTENSION_BLOCKED_RETRY_SECONDS));
            case NOT_FOUND -> ChatResponse.builder(ChatFetchResponseType.NOT_FOUND, requestId);
            case INVALID_PREVIOUS_RESPONSE_ID -> ChatResponse.builder(ChatFetchResponseType.INVALID_STATEFUL_MARKER, requestId);
            case SERVER_CANCELED -> ChatResponse.builder(ChatFetchResponseType.FAILED, requestId);
            case UNKNOWN -> ChatResponse.builder(ChatFetchResponseType.UNKNOWN, requestId);
        };
        return builder
                .reason(failure.reason())
                .serverRequestId(failure.requestId().serverRequestId())
                .errorDetails(failure.errorDetails())
                .build();
    }

    ChatRequestOptions prepareOptions(ChatRequestOptions requestOptions, ChatEndpoint endpoint, Integer forcedN) {
        ChatRequestOptions.Builder builder = requestOptions.toBuilder().stream(true);
        if (requestOptions.getTemperature().isEmpty()) {
            builder.temperature(settings.getDefaultTemperature());
        }
        if (requestOptions.getTopP().isEmpty()) {
            builder.topP(settings.getDefaultTopP());
        }
        boolean hasPrediction = requestOptions.getPrediction().filter(p -> !p.isEmpty()).isPresent();
        if (!hasPrediction) {
            builder.prediction(null);
            if (requestOptions.getMaxTokens().isEmpty()) {
                builder.maxTokens(endpoint.getMaxOutputTokens());
            }
        }
        if (forcedN != null) {
            builder.n(forcedN);
        }
        return builder.build();
    }

    private static String resolveRequestId(Map<String, String> telemetryProperties) {
        String requestId = telemetryProperties.get("requestId");
        if (requestId == null || requestId.isEmpty()) {
            requestId = telemetryProperties.get("messageId");
        }
        return requestId == null || requestId.isEmpty() ? UUID.randomUUID().toString() : requestId;
    }

    private int countTokens(ChatEndpoint endpoint, List<ChatMessage> messages) {
        try {
            Tokenizer tokenizer = endpoint.acquireTokenizer();
            return tokenizer != null ? tokenizer.countMessagesTokens(messages) : -1;
        } catch (RuntimeException e) {
            logger.warn("Failed to count prompt tokens for {}: {}", endpoint.getModel(), e.getMessage());
            return -1;
        }
    }

    private void publish(MadeChatRequestEvent event) {
        for (Consumer<MadeChatRequestEvent> listener : chatRequestListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Chat request listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static void resolve(PendingLoggedChatRequest pending, ChatResponse response, FetchStreamRecorder recorder) {
        if (response.getType() == ChatFetchResponseType.CANCELED) {
            pending.resolveCancelled();
        } else {
            pending.resolve(response, recorder.getDeltas());
        }
    }

    private ChatResponse canceled(CallContext call, String reason) {
        logger.debug("[{}] Request '{}' cancelled {}", call.requestId, call.options.getDebugName(), reason);
        sendCancelled(call);
        return ChatResponse.builder(ChatFetchResponseType.CANCELED, call.requestId)
                .reason(reason)
                .build();
    }

    private void sendCancelled(CallContext call) {
        TelemetryData data = baseTelemetry(call)
                .measurement("timeToCancelled", clock.millis() - call.issuedTime);
        telemetry.sendEvent("response.cancelled", data);
    }

    private void sendResponseError(CallContext call, ChatResponse response) {
        telemetry.sendEvent("response.error", baseTelemetry(call)
                .property("type", response.getType().name())
                .property("reason", response.getReason())
                .property("serverRequestId", response.getServerRequestId().orElse(null)));
    }

    private void sendTerminal(String eventName, CallContext call, ChatResponse response, int tokenCount) {
        telemetry.sendEvent(eventName, baseTelemetry(call)
                .property("type", response.getType().name())
                .property("serverRequestId", response.getServerRequestId().orElse(null))
                .property("resolvedModel", response.getResolvedModel().orElse(null))
                .measurement("promptTokenCount", tokenCount)
                .measurement("completionTokens", response.getUsage().map(u -> u.completionTokens()).orElse(-1))
                .measurement("timeToComplete", clock.millis() - call.issuedTime));
    }

    private TelemetryData baseTelemetry(CallContext call) {
        ChatEndpoint endpoint = call.options.getEndpoint();
        long firstToken = call.recorder.getFirstTokenEmittedTime().orElse(-1);
        return TelemetryData.create(clock.instant())
                .properties(call.options.getTelemetryProperties())
                .property("requestId", call.requestId)
                .property("model", endpoint.getModel())
                .property("apiType", endpoint.getApiType())
                .measurement("totalTokenMax", endpoint.getModelMaxPromptTokens())
                .measurement("tokenCountMax", call.postOptions.getMaxTokens().orElse(-1))
                .measurement("timeToFirstTokenEmitted", firstToken < 0 ? -1 : firstToken - call.issuedTime);
    }

    /**
     * Per-call state shared by the stages of one {@link #fetch} invocation.
     */
    private static final class CallContext {
        private final ChatFetchOptions options;
        private final String requestId;
        private final ChatRequestOptions postOptions;
        private final FetchStreamRecorder recorder;
        private final long issuedTime;
        private final Integer forcedN;

        private CallContext(ChatFetchOptions options, String requestId, ChatRequestOptions postOptions,
                            FetchStreamRecorder recorder, long issuedTime, Integer forcedN) {
            this.options = options;
            this.requestId = requestId;
            this.postOptions = postOptions;
            this.recorder = recorder;
            this.issuedTime = issuedTime;
            this.forcedN = forcedN;
        }
    }

    public static final class Builder {
        private ChatFetcherSettings settings = ChatFetcherSettings.defaults();
        private FetcherService fetcherService;
        private AuthenticationService authenticationService;
        private ChatQuotaService quotaService = ChatQuotaService.NO_OP;
        private RequestLogger requestLogger = RequestLogger.NO_OP;
        private TelemetrySink telemetrySink = TelemetrySink.NO_OP;
        private RepetitionDetector repetitionDetector = new TokenRepetitionDetector();

        private Builder() {
        }

        public Builder settings(ChatFetcherSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        /**
         * Defaults to an HTTP/2 client with an HTTP/1.1 alternate.
         */
        public Builder fetcherService(FetcherService fetcherService) {
            this.fetcherService = fetcherService;
            return this;
        }

        public Builder authenticationService(AuthenticationService authenticationService) {
            this.authenticationService = authenticationService;
            return this;
        }

        public Builder quotaService(ChatQuotaService quotaService) {
            this.quotaService = Objects.requireNonNull(quotaService, "quotaService");
            return this;
        }

        public Builder requestLogger(RequestLogger requestLogger) {
            this.requestLogger = Objects.requireNonNull(requestLogger, "requestLogger");
            return this;
        }

        public Builder telemetrySink(TelemetrySink telemetrySink) {
            this.telemetrySink = Objects.requireNonNull(telemetrySink, "telemetrySink");
            return this;
        }

        public Builder repetitionDetector(RepetitionDetector repetitionDetector) {
            this.repetitionDetector = Objects.requireNonNull(repetitionDetector, "repetitionDetector");
            return this;
        }

        public ChatFetcher build() {
            return new ChatFetcher(this);
        }
    }
}
