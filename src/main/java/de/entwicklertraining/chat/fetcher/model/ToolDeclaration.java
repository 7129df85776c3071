package de.entwicklertraining.chat.fetcher.model;

import org.json.JSONObject;

/**
 * A {@code function}-typed tool.
 */
public record ToolDeclaration(FunctionDeclaration function) {

    public JSONObject toJson() {
        return new JSONObject()
                .put("type", "function")
                .put("function", function.toJson());
    }
}
