package de.entwicklertraining.chat.fetcher.model;

import org.json.JSONObject;

/**
 * A callable function offered to the model.
 *
 * @param name        function name, must match {@code ^[a-zA-Z0-9_-]+$}
 * @param description free text shown to the model, may be null
 * @param parameters  JSON schema of the arguments, may be null
 */
public record FunctionDeclaration(String name, String description, JSONObject parameters) {

    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("name", name);
        if (description != null) {
            json.put("description", description);
        }
        json.put("parameters", parameters != null ? parameters : new JSONObject().put("type", "object"));
        return json;
    }
}
