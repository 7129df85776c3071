package de.entwicklertraining.chat.fetcher.transport;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * HTTP settings shared by all requests of a fetcher: extra headers, request modifiers and the
 * connect timeout.
 * <pre>
 * FetcherHttpConfiguration config = FetcherHttpConfiguration.builder()
 *     .header("User-Agent", "my-editor/1.0")
 *     .requestModifier(builder -> builder.header("X-Trace", traceId()))
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class FetcherHttpConfiguration {

    private final Map<String, String> globalHeaders;
    private final List<Consumer<HttpRequest.Builder>> requestModifiers;
    private final Duration connectTimeout;

    private FetcherHttpConfiguration(Builder builder) {
        this.globalHeaders = Map.copyOf(builder.globalHeaders);
        this.requestModifiers = List.copyOf(builder.requestModifiers);
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FetcherHttpConfiguration defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .headers(globalHeaders)
                .requestModifiers(requestModifiers)
                .connectTimeout(connectTimeout);
    }

    public Map<String, String> getGlobalHeaders() {
        return globalHeaders;
    }

    public List<Consumer<HttpRequest.Builder>> getRequestModifiers() {
        return requestModifiers;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public static class Builder {
        private final Map<String, String> globalHeaders = new HashMap<>();
        private final List<Consumer<HttpRequest.Builder>> requestModifiers = new ArrayList<>();
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Builder() {
        }

        public Builder header(String name, String value) {
            globalHeaders.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            globalHeaders.putAll(headers);
            return this;
        }

        /**
         * Adds a modifier applied to every {@link HttpRequest.Builder} after all headers were set.
         */
        public Builder requestModifier(Consumer<HttpRequest.Builder> modifier) {
            requestModifiers.add(modifier);
            return this;
        }

        public Builder requestModifiers(List<Consumer<HttpRequest.Builder>> modifiers) {
            requestModifiers.addAll(modifiers);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public FetcherHttpConfiguration build() {
            return new FetcherHttpConfiguration(this);
        }
    }
}
