package de.entwicklertraining.chat.fetcher.endpoint;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationException;
import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.model.ChatCompletion;
import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.ChatRequestOptions;
import de.entwicklertraining.chat.fetcher.model.ContentPart;
import de.entwicklertraining.chat.fetcher.model.FunctionDeclaration;
import de.entwicklertraining.chat.fetcher.model.ImagePart;
import de.entwicklertraining.chat.fetcher.model.ModelRequestId;
import de.entwicklertraining.chat.fetcher.model.TextPart;
import de.entwicklertraining.chat.fetcher.model.ToolCallPart;
import de.entwicklertraining.chat.fetcher.model.ToolDeclaration;
import de.entwicklertraining.chat.fetcher.model.ToolResultPart;
import de.entwicklertraining.chat.fetcher.streaming.FinishedCallback;
import de.entwicklertraining.chat.fetcher.streaming.SSEStreamProcessor;
import de.entwicklertraining.chat.fetcher.streaming.StreamProcessor;
import de.entwicklertraining.chat.fetcher.transport.FetchResponse;
import de.entwicklertraining.chat.fetcher.transport.FetcherException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Endpoint speaking the OpenAI chat-completions dialect with server-sent events.
 * <pre>
 * ChatEndpoint endpoint = OpenAiChatEndpoint.builder()
 *     .model("gpt-4o")
 *     .url(URI.create("https://api.example.com/chat/completions"))
 *     .maxOutputTokens(4096)
 *     .modelMaxPromptTokens(128000)
 *     .supportsVision(true)
 *     .build();
 * </pre>
 */
public class OpenAiChatEndpoint implements ChatEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiChatEndpoint.class);

    private final String model;
    private final URI url;
    private final int maxOutputTokens;
    private final int modelMaxPromptTokens;
    private final boolean supportsVision;
    private final Tokenizer tokenizer;

    private OpenAiChatEndpoint(Builder builder) {
        this.model = Objects.requireNonNull(builder.model, "model");
        this.url = Objects.requireNonNull(builder.url, "url");
        this.maxOutputTokens = builder.maxOutputTokens;
        this.modelMaxPromptTokens = builder.modelMaxPromptTokens;
        this.supportsVision = builder.supportsVision;
        this.tokenizer = builder.tokenizer;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public URI getUrl() {
        return url;
    }

    @Override
    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    @Override
    public int getModelMaxPromptTokens() {
        return modelMaxPromptTokens;
    }

    @Override
    public String getApiType() {
        return "chatCompletions";
    }

    @Override
    public boolean supportsVision() {
        return supportsVision;
    }

    @Override
    public Tokenizer acquireTokenizer() {
        return tokenizer;
    }

    @Override
    public JSONObject createRequestBody(ChatEndpointRequest request) {
        ChatRequestOptions options = request.options();
        JSONObject body = new JSONObject()
                .put("model", model)
                .put("messages", toJson(request.messages()));

        options.getTemperature().ifPresent(t -> body.put("temperature", t));
        options.getTopP().ifPresent(p -> body.put("top_p", p));
        options.getMaxTokens().ifPresent(m -> body.put("max_tokens", m));
        if (options.getN() > 1) {
            body.put("n", options.getN());
        }
        body.put("stream", options.isStream());
        if (options.isStream()) {
            body.put("stream_options", new JSONObject().put("include_usage", true));
        }

        if (!options.getFunctions().isEmpty()) {
            JSONArray functions = new JSONArray();
            options.getFunctions().stream().map(FunctionDeclaration::toJson).forEach(functions::put);
            body.put("functions", functions);
        }
        options.getFunctionCall().ifPresent(name -> body.put("function_call", new JSONObject().put("name", name)));

        if (!options.getTools().isEmpty()) {
            JSONArray tools = new JSONArray();
            options.getTools().stream().map(ToolDeclaration::toJson).forEach(tools::put);
            body.put("tools", tools);
        }
        options.getToolChoice().ifPresent(choice -> body.put("tool_choice", choice));
        options.getPrediction().ifPresent(content ->
                body.put("prediction", new JSONObject().put("type", "content").put("content", content)));
        return body;
    }

    private static JSONArray toJson(List<ChatMessage> messages) {
        JSONArray array = new JSONArray();
        for (ChatMessage message : messages) {
            array.put(toJson(message));
        }
        return array;
    }

    private static JSONObject toJson(ChatMessage message) {
        JSONObject json = new JSONObject().put("role", message.role().wireName());
        if (message.name() != null) {
            json.put("name", message.name());
        }

        ToolResultPart toolResult = message.content().stream()
                .filter(ToolResultPart.class::isInstance)
                .map(ToolResultPart.class::cast)
                .findFirst()
                .orElse(null);
        if (toolResult != null) {
            return json.put("tool_call_id", toolResult.toolCallId()).put("content", toolResult.content());
        }

        if (message.hasImages()) {
            JSONArray parts = new JSONArray();
            for (ContentPart part : message.content()) {
                if (part instanceof TextPart text) {
                    parts.put(new JSONObject().put("type", "text").put("text", text.text()));
                } else if (part instanceof ImagePart image) {
                    JSONObject imageUrl = new JSONObject().put("url", image.url());
                    if (image.detail() != null) {
                        imageUrl.put("detail", image.detail());
                    }
                    parts.put(new JSONObject().put("type", "image_url").put("image_url", imageUrl));
                }
            }
            json.put("content", parts);
        } else {
            json.put("content", message.text());
        }

        List<ToolCallPart> toolCalls = message.toolCalls();
        if (!toolCalls.isEmpty()) {
            JSONArray calls = new JSONArray();
            for (ToolCallPart call : toolCalls) {
                calls.put(new JSONObject()
                        .put("id", call.id())
                        .put("type", "function")
                        .put("function", new JSONObject().put("name", call.name()).put("arguments", call.arguments())));
            }
            json.put("tool_calls", calls);
        }
        return json;
    }

    @Override
    public List<ChatCompletion> processResponse(FetchResponse response, int expectedChoices, FinishedCallback callback,
                                                CancellationToken token) {
        OpenAiStreamReader reader = new OpenAiStreamReader(expectedChoices, callback,
                ModelRequestId.fromHeaders(response.headers()), token);
        SSEStreamProcessor<JSONObject> processor = SSEStreamProcessor.forJson();

        try (CancellationToken.Registration ignored = token.onCancelled(response::destroy);
             BufferedReader lines = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            String line;
            while (!reader.shouldCancel() && (line = lines.readLine()) != null) {
                processor.processLine(line, reader);
                if (reader.isDone()) {
                    break;
                }
            }
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw new CancellationException("Cancelled while reading the response stream", e);
            }
            if (response.isDestroyed()) {
                throw new FetcherException.PrematureCloseException("Premature close", e);
            }
            throw new FetcherException("Failed to read response stream: " + e.getMessage(), e);
        } catch (StreamProcessor.StreamProcessingException e) {
            throw new FetcherException("Failed to process response stream: " + e.getMessage(), e);
        }

        if (token.isCancelled()) {
            response.destroy();
            throw new CancellationException("Cancelled while reading the response stream");
        }

        List<ChatCompletion> completions = reader.completions();
        logger.debug("Received {} candidate(s) from {}", completions.size(), model);
        return completions;
    }

    public static class Builder {
        private String model;
        private URI url;
        private int maxOutputTokens = 4096;
        private int modelMaxPromptTokens = 128_000;
        private boolean supportsVision;
        private Tokenizer tokenizer = messages -> -1;

        private Builder() {
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder url(URI url) {
            this.url = url;
            return this;
        }

        public Builder maxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder modelMaxPromptTokens(int modelMaxPromptTokens) {
            this.modelMaxPromptTokens = modelMaxPromptTokens;
            return this;
        }

        public Builder supportsVision(boolean supportsVision) {
            this.supportsVision = supportsVision;
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        public OpenAiChatEndpoint build() {
            return new OpenAiChatEndpoint(this);
        }
    }
}
