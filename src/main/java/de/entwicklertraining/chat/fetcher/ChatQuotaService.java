package de.entwicklertraining.chat.fetcher;

import java.net.http.HttpHeaders;

/**
 * Keeps quota bookkeeping up to date from the headers of successful responses.
 */
@FunctionalInterface
public interface ChatQuotaService {

    ChatQuotaService NO_OP = headers -> { };

    void processQuotaHeaders(HttpHeaders headers);
}
