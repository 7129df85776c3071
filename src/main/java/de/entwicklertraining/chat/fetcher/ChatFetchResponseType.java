package de.entwicklertraining.chat.fetcher;

/**
 * Terminal outcome of a chat request. Callers are expected to switch over every value.
 */
public enum ChatFetchResponseType {
    SUCCESS,
    /** Content filter hit that is eligible for an automatic retry. Never returned from {@link ChatFetcher}. */
    FILTERED_RETRY,
    FILTERED,
    /** The prompt itself was rejected by the content filter. */
    PROMPT_FILTERED,
    LENGTH,
    RATE_LIMITED,
    QUOTA_EXCEEDED,
    TOKEN_EXPIRED_OR_INVALID,
    BAD_REQUEST,
    NOT_FOUND,
    OFF_TOPIC,
    SERVER_ERROR,
    NETWORK_ERROR,
    CANCELED,
    EXTENSION_BLOCKED,
    AGENT_UNAUTHORIZED,
    AGENT_FAILED_DEPENDENCY,
    INVALID_STATEFUL_MARKER,
    FAILED,
    UNKNOWN
}
