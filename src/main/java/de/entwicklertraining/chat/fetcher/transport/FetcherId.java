package de.entwicklertraining.chat.fetcher.transport;

/**
 * Identifies one of the registered HTTP transports.
 */
public enum FetcherId {
    /** java.net.http client negotiating HTTP/2. */
    HTTP2_CLIENT,
    /** java.net.http client pinned to HTTP/1.1, used as the alternate transport. */
    HTTP1_CLIENT
}
