package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.endpoint.ChatEndpoint;
import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;
import de.entwicklertraining.chat.fetcher.streaming.FinishedCallback;
import de.entwicklertraining.chat.fetcher.transport.FetcherId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical chat request.
 *
 * <p>Instances are immutable except for the telemetry property map, which collaborators may extend
 * while the request runs. Derived requests, such as automatic retries, are created with
 * {@link #toBuilder()}.
 * <pre>
 * ChatFetchOptions options = ChatFetchOptions.builder("inline-chat", endpoint)
 *     .messages(List.of(ChatMessage.system(systemPrompt), ChatMessage.user(question)))
 *     .location(ChatLocation.EDITOR)
 *     .finishedCallback((text, index, delta) -> { render(delta.text()); return null; })
 *     .enableRetryOnFilter(true)
 *     .cancellationToken(source.getToken())
 *     .build();
 * </pre>
 */
public final class ChatFetchOptions {

    private final String debugName;
    private final ChatEndpoint endpoint;
    private final List<ChatMessage> messages;
    private final ChatRequestOptions requestOptions;
    private final ChatLocation location;
    private final FinishedCallback finishedCallback;
    private final Map<String, String> telemetryProperties;
    private final boolean userInitiatedRequest;
    private final boolean enableRetryOnFilter;
    private final Boolean enableRetryOnError;
    private final FetcherId useFetcher;
    private final boolean ignoreStatefulMarker;
    private final CancellationToken cancellationToken;

    private ChatFetchOptions(Builder builder) {
        this.debugName = Objects.requireNonNull(builder.debugName, "debugName");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint");
        this.messages = List.copyOf(builder.messages);
        this.requestOptions = builder.requestOptions;
        this.location = builder.location;
        this.finishedCallback = builder.finishedCallback;
        this.telemetryProperties = Collections.synchronizedMap(new LinkedHashMap<>(builder.telemetryProperties));
        this.userInitiatedRequest = builder.userInitiatedRequest;
        this.enableRetryOnFilter = builder.enableRetryOnFilter;
        this.enableRetryOnError = builder.enableRetryOnError;
        this.useFetcher = builder.useFetcher;
        this.ignoreStatefulMarker = builder.ignoreStatefulMarker;
        this.cancellationToken = builder.cancellationToken;
    }

    public static Builder builder(String debugName, ChatEndpoint endpoint) {
        return new Builder(debugName, endpoint);
    }

    /**
     * A builder holding a copy of every value. The telemetry map is copied, not shared.
     */
    public Builder toBuilder() {
        return new Builder(debugName, endpoint)
                .messages(messages)
                .requestOptions(requestOptions)
                .location(location)
                .finishedCallback(finishedCallback)
                .telemetryProperties(telemetryProperties)
                .userInitiatedRequest(userInitiatedRequest)
                .enableRetryOnFilter(enableRetryOnFilter)
                .enableRetryOnError(enableRetryOnError)
                .useFetcher(useFetcher)
                .ignoreStatefulMarker(ignoreStatefulMarker)
                .cancellationToken(cancellationToken);
    }

    public String getDebugName() {
        return debugName;
    }

    public ChatEndpoint getEndpoint() {
        return endpoint;
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public ChatRequestOptions getRequestOptions() {
        return requestOptions;
    }

    public ChatLocation getLocation() {
        return location;
    }

    public Optional<FinishedCallback> getFinishedCallback() {
        return Optional.ofNullable(finishedCallback);
    }

    /**
     * Mutable telemetry properties. Never consulted for control flow, except that {@code requestId}
     * and {@code messageId} seed the request id.
     */
    public Map<String, String> getTelemetryProperties() {
        return telemetryProperties;
    }

    public boolean isUserInitiatedRequest() {
        return userInitiatedRequest;
    }

    public boolean isRetryOnFilterEnabled() {
        return enableRetryOnFilter;
    }

    /**
     * Whether a network-changed failure may be retried; follows the filter retry flag when unset.
     */
    public boolean isRetryOnErrorEnabled() {
        return enableRetryOnError != null ? enableRetryOnError : enableRetryOnFilter;
    }

    public Optional<FetcherId> getUseFetcher() {
        return Optional.ofNullable(useFetcher);
    }

    public boolean isIgnoreStatefulMarker() {
        return ignoreStatefulMarker;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public static final class Builder {
        private String debugName;
        private ChatEndpoint endpoint;
        private final List<ChatMessage> messages = new ArrayList<>();
        private ChatRequestOptions requestOptions = ChatRequestOptions.empty();
        private ChatLocation location = ChatLocation.OTHER;
        private FinishedCallback finishedCallback;
        private final Map<String, String> telemetryProperties = new LinkedHashMap<>();
        private boolean userInitiatedRequest;
        private boolean enableRetryOnFilter;
        private Boolean enableRetryOnError;
        private FetcherId useFetcher;
        private boolean ignoreStatefulMarker;
        private CancellationToken cancellationToken = CancellationToken.none();

        private Builder(String debugName, ChatEndpoint endpoint) {
            this.debugName = debugName;
            this.endpoint = endpoint;
        }

        public Builder debugName(String debugName) {
            this.debugName = debugName;
            return this;
        }

        public Builder endpoint(ChatEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder addMessage(ChatMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder requestOptions(ChatRequestOptions requestOptions) {
            this.requestOptions = Objects.requireNonNull(requestOptions, "requestOptions");
            return this;
        }

        public Builder location(ChatLocation location) {
            this.location = Objects.requireNonNull(location, "location");
            return this;
        }

        public Builder finishedCallback(FinishedCallback finishedCallback) {
            this.finishedCallback = finishedCallback;
            return this;
        }

        public Builder telemetryProperties(Map<String, String> telemetryProperties) {
            this.telemetryProperties.clear();
            this.telemetryProperties.putAll(telemetryProperties);
            return this;
        }

        public Builder telemetryProperty(String name, String value) {
            this.telemetryProperties.put(name, value);
            return this;
        }

        public Builder userInitiatedRequest(boolean userInitiatedRequest) {
            this.userInitiatedRequest = userInitiatedRequest;
            return this;
        }

        public Builder enableRetryOnFilter(boolean enableRetryOnFilter) {
            this.enableRetryOnFilter = enableRetryOnFilter;
            return this;
        }

        /**
         * @param enableRetryOnError null to follow {@link #enableRetryOnFilter(boolean)}
         */
        public Builder enableRetryOnError(Boolean enableRetryOnError) {
            this.enableRetryOnError = enableRetryOnError;
            return this;
        }

        public Builder useFetcher(FetcherId useFetcher) {
            this.useFetcher = useFetcher;
            return this;
        }

        public Builder ignoreStatefulMarker(boolean ignoreStatefulMarker) {
            this.ignoreStatefulMarker = ignoreStatefulMarker;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
            return this;
        }

        public ChatFetchOptions build() {
            return new ChatFetchOptions(this);
        }
    }
}
