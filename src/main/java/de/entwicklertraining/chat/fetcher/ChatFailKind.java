package de.entwicklertraining.chat.fetcher;

/**
 * Classification of a non-2xx provider response.
 */
public enum ChatFailKind {
    OFF_TOPIC,
    TOKEN_EXPIRED_OR_INVALID,
    SERVER_CANCELED,
    CLIENT_NOT_SUPPORTED,
    RATE_LIMITED,
    QUOTA_EXCEEDED,
    EXTENSION_BLOCKED,
    SERVER_ERROR,
    CONTENT_FILTER,
    AGENT_UNAUTHORIZED,
    AGENT_FAILED_DEPENDENCY,
    INVALID_PREVIOUS_RESPONSE_ID,
    NOT_FOUND,
    UNKNOWN;

    /**
     * Whether the cached credential must be dropped so the next call fetches a fresh one.
     */
    public boolean invalidatesCredential() {
        return this == TOKEN_EXPIRED_OR_INVALID || this == QUOTA_EXCEEDED;
    }
}
