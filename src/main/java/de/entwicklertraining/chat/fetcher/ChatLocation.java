package de.entwicklertraining.chat.fetcher;

/**
 * The surface a chat request originates from. Sent to the provider as the {@code OpenAI-Intent} header.
 */
public enum ChatLocation {
    PANEL("conversation-panel"),
    EDITOR("conversation-inline"),
    EDITING_SESSION("conversation-edits"),
    NOTEBOOK("conversation-notebook"),
    TERMINAL("conversation-terminal"),
    AGENT("conversation-agent"),
    RESPONSES_PROXY("responses-proxy"),
    OTHER("conversation-other");

    private final String intent;

    ChatLocation(String intent) {
        this.intent = intent;
    }

    public String toIntent() {
        return intent;
    }
}
