package de.entwicklertraining.chat.fetcher.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sampling and tool options sent with a chat request.
 * <p>
 * All values are optional. Unset sampling values are filled in from
 * {@link de.entwicklertraining.chat.fetcher.ChatFetcherSettings} before the request is sent.
 * <pre>
 * ChatRequestOptions options = ChatRequestOptions.builder()
 *     .temperature(0.2)
 *     .maxTokens(4096)
 *     .tools(List.of(readFileTool))
 *     .build();
 * </pre>
 */
public final class ChatRequestOptions {

    private final Double temperature;
    private final Double topP;
    private final Integer maxTokens;
    private final Integer n;
    private final Boolean stream;
    private final List<FunctionDeclaration> functions;
    private final String functionCall;
    private final List<ToolDeclaration> tools;
    private final String toolChoice;
    private final String prediction;
    private final String secretKey;

    private ChatRequestOptions(Builder builder) {
        this.temperature = builder.temperature;
        this.topP = builder.topP;
        this.maxTokens = builder.maxTokens;
        this.n = builder.n;
        this.stream = builder.stream;
        this.functions = List.copyOf(builder.functions);
        this.functionCall = builder.functionCall;
        this.tools = List.copyOf(builder.tools);
        this.toolChoice = builder.toolChoice;
        this.prediction = builder.prediction;
        this.secretKey = builder.secretKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ChatRequestOptions empty() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .temperature(temperature)
                .topP(topP)
                .maxTokens(maxTokens)
                .n(n)
                .stream(stream)
                .functions(functions)
                .functionCall(functionCall)
                .tools(tools)
                .toolChoice(toolChoice)
                .prediction(prediction)
                .secretKey(secretKey);
    }

    public Optional<Double> getTemperature() {
        return Optional.ofNullable(temperature);
    }

    public Optional<Double> getTopP() {
        return Optional.ofNullable(topP);
    }

    public Optional<Integer> getMaxTokens() {
        return Optional.ofNullable(maxTokens);
    }

    /**
     * Number of candidate completions requested, 1 if unset.
     */
    public int getN() {
        return n != null ? n : 1;
    }

    public boolean isStream() {
        return stream != null && stream;
    }

    public List<FunctionDeclaration> getFunctions() {
        return functions;
    }

    /**
     * Name of the function the model is forced to call.
     */
    public Optional<String> getFunctionCall() {
        return Optional.ofNullable(functionCall);
    }

    public List<ToolDeclaration> getTools() {
        return tools;
    }

    public Optional<String> getToolChoice() {
        return Optional.ofNullable(toolChoice);
    }

    /**
     * Speculative output content the model may reuse.
     */
    public Optional<String> getPrediction() {
        return Optional.ofNullable(prediction);
    }

    /**
     * Per-call credential overriding the authentication service.
     */
    public Optional<String> getSecretKey() {
        return Optional.ofNullable(secretKey);
    }

    public static final class Builder {
        private Double temperature;
        private Double topP;
        private Integer maxTokens;
        private Integer n;
        private Boolean stream;
        private final List<FunctionDeclaration> functions = new ArrayList<>();
        private String functionCall;
        private final List<ToolDeclaration> tools = new ArrayList<>();
        private String toolChoice;
        private String prediction;
        private String secretKey;

        private Builder() {
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder n(Integer n) {
            this.n = n;
            return this;
        }

        public Builder stream(Boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder functions(List<FunctionDeclaration> functions) {
            this.functions.clear();
            this.functions.addAll(functions);
            return this;
        }

        public Builder functionCall(String functionCall) {
            this.functionCall = functionCall;
            return this;
        }

        public Builder tools(List<ToolDeclaration> tools) {
            this.tools.clear();
            this.tools.addAll(tools);
            return this;
        }

        public Builder toolChoice(String toolChoice) {
            this.toolChoice = toolChoice;
            return this;
        }

        public Builder prediction(String prediction) {
            this.prediction = prediction;
            return this;
        }

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        public ChatRequestOptions build() {
            return new ChatRequestOptions(this);
        }
    }
}
