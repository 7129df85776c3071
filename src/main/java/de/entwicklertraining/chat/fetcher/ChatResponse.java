package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.model.Usage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of {@link ChatFetcher#fetchMany} and {@link ChatFetcher#fetchOne}.
 *
 * <p>Which of the optional fields are populated depends on {@link #getType()}:
 * <ul>
 *   <li>{@code SUCCESS}: values, resolved model and, for a single candidate, usage</li>
 *   <li>{@code FILTERED}, {@code PROMPT_FILTERED}: category</li>
 *   <li>{@code LENGTH}: truncated value</li>
 *   <li>{@code RATE_LIMITED}, {@code QUOTA_EXCEEDED}, {@code EXTENSION_BLOCKED}: retry-after and error details</li>
 *   <li>{@code AGENT_UNAUTHORIZED}: authorization URL</li>
 * </ul>
 * Every response carries the request id. The server request id is set when the provider returned one.
 */
public final class ChatResponse {

    private final ChatFetchResponseType type;
    private final String requestId;
    private final String serverRequestId;
    private final String reason;
    private final String reasonDetail;
    private final List<String> values;
    private final String truncatedValue;
    private final String resolvedModel;
    private final Usage usage;
    private final FilterReason category;
    private final Instant retryAfter;
    private final String rateLimitKey;
    private final String authorizationUrl;
    private final String streamError;
    private final Map<String, Object> errorDetails;

    private ChatResponse(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.requestId = Objects.requireNonNull(builder.requestId, "requestId");
        this.serverRequestId = builder.serverRequestId;
        this.reason = builder.reason;
        this.reasonDetail = builder.reasonDetail;
        this.values = List.copyOf(builder.values);
        this.truncatedValue = builder.truncatedValue;
        this.resolvedModel = builder.resolvedModel;
        this.usage = builder.usage;
        this.category = builder.category;
        this.retryAfter = builder.retryAfter;
        this.rateLimitKey = builder.rateLimitKey;
        this.authorizationUrl = builder.authorizationUrl;
        this.streamError = builder.streamError;
        this.errorDetails = builder.errorDetails != null ? builder.errorDetails : Map.of();
    }

    public static Builder builder(ChatFetchResponseType type, String requestId) {
        return new Builder(type, requestId);
    }

    public Builder toBuilder() {
        return new Builder(type, requestId)
                .serverRequestId(serverRequestId)
                .reason(reason)
                .reasonDetail(reasonDetail)
                .values(values)
                .truncatedValue(truncatedValue)
                .resolvedModel(resolvedModel)
                .usage(usage)
                .category(category)
                .retryAfter(retryAfter)
                .rateLimitKey(rateLimitKey)
                .authorizationUrl(authorizationUrl)
                .streamError(streamError)
                .errorDetails(errorDetails);
    }

    public ChatFetchResponseType getType() {
        return type;
    }

    public boolean isSuccess() {
        return type == ChatFetchResponseType.SUCCESS;
    }

    public String getRequestId() {
        return requestId;
    }

    public Optional<String> getServerRequestId() {
        return Optional.ofNullable(serverRequestId);
    }

    /**
     * Human readable reason for every non-success outcome.
     */
    public String getReason() {
        return reason;
    }

    public Optional<String> getReasonDetail() {
        return Optional.ofNullable(reasonDetail);
    }

    /**
     * Text of every successful candidate, in candidate order.
     */
    public List<String> getValues() {
        return values;
    }

    /**
     * Text of the first candidate, empty string if there is none.
     */
    public String getValue() {
        return values.isEmpty() ? "" : values.get(0);
    }

    public Optional<String> getTruncatedValue() {
        return Optional.ofNullable(truncatedValue);
    }

    public Optional<String> getResolvedModel() {
        return Optional.ofNullable(resolvedModel);
    }

    public Optional<Usage> getUsage() {
        return Optional.ofNullable(usage);
    }

    public Optional<FilterReason> getCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<Instant> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public Optional<String> getRateLimitKey() {
        return Optional.ofNullable(rateLimitKey);
    }

    public Optional<String> getAuthorizationUrl() {
        return Optional.ofNullable(authorizationUrl);
    }

    public Optional<String> getStreamError() {
        return Optional.ofNullable(streamError);
    }

    /**
     * The provider's error object for classified HTTP failures.
     */
    public Map<String, Object> getErrorDetails() {
        return errorDetails;
    }

    @Override
    public String toString() {
        return "ChatResponse{type=" + type + ", requestId=" + requestId
                + (reason != null ? ", reason=" + reason : "")
                + (values.isEmpty() ? "" : ", values=" + values.size())
                + "}";
    }

    public static final class Builder {
        private final ChatFetchResponseType type;
        private final String requestId;
        private String serverRequestId;
        private String reason;
        private String reasonDetail;
        private List<String> values = List.of();
        private String truncatedValue;
        private String resolvedModel;
        private Usage usage;
        private FilterReason category;
        private Instant retryAfter;
        private String rateLimitKey;
        private String authorizationUrl;
        private String streamError;
        private Map<String, Object> errorDetails;

        private Builder(ChatFetchResponseType type, String requestId) {
            this.type = type;
            this.requestId = requestId;
        }

        public Builder serverRequestId(String serverRequestId) {
            this.serverRequestId = serverRequestId == null || serverRequestId.isEmpty() ? null : serverRequestId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder reasonDetail(String reasonDetail) {
            this.reasonDetail = reasonDetail;
            return this;
        }

        public Builder values(List<String> values) {
            this.values = values;
            return this;
        }

        public Builder truncatedValue(String truncatedValue) {
            this.truncatedValue = truncatedValue;
            return this;
        }

        public Builder resolvedModel(String resolvedModel) {
            this.resolvedModel = resolvedModel;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        public Builder category(FilterReason category) {
            this.category = category;
            return this;
        }

        public Builder retryAfter(Instant retryAfter) {
            this.retryAfter = retryAfter;
            return this;
        }

        public Builder rateLimitKey(String rateLimitKey) {
            this.rateLimitKey = rateLimitKey;
            return this;
        }

        public Builder authorizationUrl(String authorizationUrl) {
            this.authorizationUrl = authorizationUrl;
            return this;
        }

        public Builder streamError(String streamError) {
            this.streamError = streamError;
            return this;
        }

        public Builder errorDetails(Map<String, Object> errorDetails) {
            this.errorDetails = errorDetails;
            return this;
        }

        public ChatResponse build() {
            return new ChatResponse(this);
        }
    }
}
