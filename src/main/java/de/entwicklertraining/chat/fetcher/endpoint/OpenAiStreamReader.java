package de.entwicklertraining.chat.fetcher.endpoint;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.model.ChatCompletion;
import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.model.FinishReason;
import de.entwicklertraining.chat.fetcher.model.ModelRequestId;
import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import de.entwicklertraining.chat.fetcher.model.ToolCallPart;
import de.entwicklertraining.chat.fetcher.model.Usage;
import de.entwicklertraining.chat.fetcher.streaming.FinishedCallback;
import de.entwicklertraining.chat.fetcher.streaming.StreamingResponseHandler;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulates chat-completion chunks into one {@link ChatCompletion} per candidate.
 */
class OpenAiStreamReader implements StreamingResponseHandler<JSONObject> {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiStreamReader.class);

    private final int expectedChoices;
    private final FinishedCallback callback;
    private final ModelRequestId requestId;
    private final CancellationToken token;
    private final Map<Integer, Choice> choices = new TreeMap<>();

    private String model;
    private String completionId;
    private Usage usage;
    private boolean completed;

    OpenAiStreamReader(int expectedChoices, FinishedCallback callback, ModelRequestId requestId, CancellationToken token) {
        this.expectedChoices = expectedChoices;
        this.callback = callback;
        this.requestId = requestId;
        this.token = token;
    }

    @Override
    public void onData(JSONObject chunk) {
        if (chunk.has("error") && !chunk.isNull("error")) {
            onStreamError(chunk.get("error"));
            return;
        }
        String chunkModel = chunk.optString("model", "");
        if (!chunkModel.isEmpty()) {
            model = chunkModel;
        }
        String id = chunk.optString("id", "");
        if (!id.isEmpty()) {
            completionId = id;
        }
        JSONObject usageJson = chunk.optJSONObject("usage");
        if (usageJson != null) {
            usage = Usage.fromJson(usageJson);
        }

        JSONArray choiceArray = chunk.optJSONArray("choices");
        if (choiceArray == null) {
            return;
        }
        for (int i = 0; i < choiceArray.length(); i++) {
            JSONObject choiceJson = choiceArray.optJSONObject(i);
            if (choiceJson != null) {
                onChoice(choiceJson);
            }
        }
    }

    private void onChoice(JSONObject choiceJson) {
        int index = choiceJson.optInt("index", 0);
        Choice choice = choices.computeIfAbsent(index, Choice::new);
        if (choice.finishReason != null) {
            return;
        }

        JSONObject delta = choiceJson.optJSONObject("delta");
        if (delta == null) {
            delta = choiceJson.optJSONObject("message");
        }
        if (delta != null) {
            String content = delta.optString("content", null);
            if (content != null && !content.isEmpty()) {
                choice.text.append(content);
                choice.tokens.add(content);
                Integer offset = callback.onDelta(choice.text.toString(), index, ResponseDelta.text(content));
                if (offset != null) {
                    choice.trim(offset);
                    return;
                }
            }
            String reasoning = delta.optString("reasoning_content", delta.optString("reasoning", null));
            if (reasoning != null && !reasoning.isEmpty()) {
                callback.onDelta(choice.text.toString(), index, ResponseDelta.thinking(reasoning));
            }
            JSONArray toolCalls = delta.optJSONArray("tool_calls");
            if (toolCalls != null) {
                for (int i = 0; i < toolCalls.length(); i++) {
                    JSONObject call = toolCalls.getJSONObject(i);
                    choice.toolCall(call.optInt("index", i)).merge(call.optString("id", null), call.optJSONObject("function"));
                }
            }
            JSONObject functionCall = delta.optJSONObject("function_call");
            if (functionCall != null) {
                choice.toolCall(0).merge(null, functionCall);
            }
        }

        JSONObject filterResults = choiceJson.optJSONObject("content_filter_results");
        if (filterResults != null && choice.filterReason == null) {
            for (String key : filterResults.keySet()) {
                JSONObject result = filterResults.optJSONObject(key);
                FilterReason reason = FilterReason.fromResultKey(key);
                if (reason != null && result != null && result.optBoolean("filtered", false)) {
                    choice.filterReason = reason;
                    break;
                }
            }
        }

        String finishReason = choiceJson.optString("finish_reason", null);
        if (finishReason != null) {
            choice.finishReason = FinishReason.fromWire(finishReason);
            if (!choice.toolCalls.isEmpty()
                    && (choice.finishReason == FinishReason.TOOL_CALLS || choice.finishReason == FinishReason.FUNCTION_CALL)) {
                callback.onDelta(choice.text.toString(), index, ResponseDelta.toolCalls(choice.completedToolCalls()));
            }
        }
    }

    private void onStreamError(Object error) {
        String message = error instanceof JSONObject
                ? ((JSONObject) error).optString("message", error.toString())
                : String.valueOf(error);
        logger.error("Provider reported an error inside the stream: {}", message);
        if (choices.isEmpty()) {
            choices.put(0, new Choice(0));
        }
        for (Choice choice : choices.values()) {
            if (choice.finishReason == null) {
                choice.finishReason = FinishReason.SERVER_ERROR;
                choice.streamError = message;
            }
        }
    }

    @Override
    public void onComplete() {
        completed = true;
    }

    @Override
    public boolean shouldCancel() {
        return token.isCancelled();
    }

    /**
     * True once the completion signal was seen or every expected candidate was trimmed by the consumer.
     */
    boolean isDone() {
        if (completed) {
            return true;
        }
        if (choices.size() < expectedChoices) {
            return false;
        }
        return choices.values().stream().allMatch(c -> c.finishReason == FinishReason.CLIENT_TRIMMED);
    }

    List<ChatCompletion> completions() {
        ModelRequestId id = requestId.withCompletionId(completionId);
        List<ChatCompletion> result = new ArrayList<>();
        for (Choice choice : choices.values()) {
            FinishReason finishReason = choice.finishReason;
            if (finishReason == null) {
                // no finish_reason: a cleanly terminated stream counts as stop
                finishReason = completed ? FinishReason.STOP : FinishReason.UNKNOWN;
            }
            result.add(new ChatCompletion(choice.index, model, finishReason, choice.text.toString(),
                    choice.completedToolCalls(), choice.tokens, usage, choice.filterReason, id, choice.streamError));
        }
        return result;
    }

    private static final class Choice {
        private final int index;
        private final StringBuilder text = new StringBuilder();
        private final List<String> tokens = new ArrayList<>();
        private final Map<Integer, ToolCallAccumulator> toolCalls = new TreeMap<>();
        private FinishReason finishReason;
        private FilterReason filterReason;
        private String streamError;

        private Choice(int index) {
            this.index = index;
        }

        private void trim(int offset) {
            text.setLength(Math.max(0, Math.min(offset, text.length())));
            finishReason = FinishReason.CLIENT_TRIMMED;
        }

        private ToolCallAccumulator toolCall(int index) {
            return toolCalls.computeIfAbsent(index, i -> new ToolCallAccumulator());
        }

        private List<ToolCallPart> completedToolCalls() {
            List<ToolCallPart> calls = new ArrayList<>();
            for (ToolCallAccumulator accumulator : toolCalls.values()) {
                calls.add(new ToolCallPart(accumulator.id, accumulator.name.toString(), accumulator.arguments.toString()));
            }
            return calls;
        }
    }

    // tool call names and arguments arrive in fragments
    private static final class ToolCallAccumulator {
        private String id;
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();

        private void merge(String id, JSONObject function) {
            if (id != null && !id.isEmpty()) {
                this.id = id;
            }
            if (function != null) {
                name.append(function.optString("name", ""));
                arguments.append(function.optString("arguments", ""));
            }
        }
    }
}
