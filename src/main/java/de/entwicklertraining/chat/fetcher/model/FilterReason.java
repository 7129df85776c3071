package de.entwicklertraining.chat.fetcher.model;

/**
 * Category reported when generated content was filtered.
 */
public enum FilterReason {
    COPYRIGHT("copyright"),
    HATE("hate"),
    SELF_HARM("self_harm"),
    SEXUAL("sexual"),
    VIOLENCE("violence"),
    PROMPT("prompt");

    private final String wireName;

    FilterReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps a {@code content_filter_results} key to a category, or null if the key is not a known category.
     */
    public static FilterReason fromResultKey(String key) {
        switch (key) {
            case "hate":
                return HATE;
            case "self_harm":
                return SELF_HARM;
            case "sexual":
                return SEXUAL;
            case "violence":
                return VIOLENCE;
            case "protected_material_code":
            case "protected_material_text":
                return COPYRIGHT;
            default:
                return null;
        }
    }
}
