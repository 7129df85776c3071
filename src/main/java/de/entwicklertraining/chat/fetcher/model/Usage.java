package de.entwicklertraining.chat.fetcher.model;

import org.json.JSONObject;

/**
 * Token accounting reported by the provider.
 */
public record Usage(int promptTokens, int completionTokens, int totalTokens, int cachedPromptTokens) {

    public static Usage fromJson(JSONObject json) {
        JSONObject details = json.optJSONObject("prompt_tokens_details");
        return new Usage(
                json.optInt("prompt_tokens", 0),
                json.optInt("completion_tokens", 0),
                json.optInt("total_tokens", 0),
                details != null ? details.optInt("cached_tokens", 0) : 0);
    }
}
