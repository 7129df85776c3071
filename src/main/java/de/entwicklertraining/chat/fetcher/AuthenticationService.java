package de.entwicklertraining.chat.fetcher;

import java.util.Optional;

/**
 * Supplies and invalidates the credential used for chat requests. The cache behind it is owned by
 * the implementation.
 */
public interface AuthenticationService {

    /**
     * @return the current bearer credential, empty if none is available
     */
    Optional<String> getCurrentToken();

    /**
     * Drops the cached credential so the next call fetches a fresh one.
     *
     * @param status HTTP status that triggered the invalidation
     */
    void invalidateToken(int status);

    /**
     * Whether the cached credential reports an exhausted chat quota.
     */
    default boolean isChatQuotaExceeded() {
        return false;
    }

    /**
     * Receives the session continuation token the provider returns with a successful response.
     */
    default void setSessionContinuationToken(String token) {
    }
}
