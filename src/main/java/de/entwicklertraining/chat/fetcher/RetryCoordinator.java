package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ChatMessage;
import de.entwicklertraining.chat.fetcher.model.FilterReason;
import de.entwicklertraining.chat.fetcher.transport.FetcherId;
import de.entwicklertraining.chat.fetcher.transport.FetcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a failed attempt gets one automatic retry and derives the retry request.
 *
 * <p>Every derived request clears the flag that allowed it, so a retry can never trigger another
 * retry of the same kind. Retries are never marked as user initiated and keep the caller's
 * cancellation token.
 */
public class RetryCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RetryCoordinator.class);

    static final String NETWORK_CHANGED_CATEGORY = "network-changed";

    private final FetcherService fetcherService;
    private final Platform platform;

    public RetryCoordinator(FetcherService fetcherService, Platform platform) {
        this.fetcherService = fetcherService;
        this.platform = platform;
    }

    /**
     * Builds the retry for a content-filtered response: the filtered text is sent back to the model
     * with a request to produce something that passes the filter.
     *
     * @param filtered a {@link ChatFetchResponseType#FILTERED_RETRY} response of {@code options}
     * @return the retry request, empty if filter retries are disabled or nothing was generated
     */
    public Optional<ChatFetchOptions> filterRetryFor(ChatFetchOptions options, ChatResponse filtered) {
        if (!options.isRetryOnFilterEnabled()) {
            return Optional.empty();
        }
        String filteredContent = filtered.getValue();
        if (filteredContent.isEmpty()) {
            logger.debug("Not retrying filtered response of '{}': no content", options.getDebugName());
            return Optional.empty();
        }

        List<ChatMessage> messages = new ArrayList<>(options.getMessages());
        messages.add(ChatMessage.user(retryMessage(filtered.getCategory().orElse(null), filteredContent)));

        String category = filtered.getCategory().map(FilterReason::wireName).orElse("uncategorized");
        logger.info("Retrying '{}' after the response was filtered ({})", options.getDebugName(), category);
        return Optional.of(options.toBuilder()
                .debugName("retry-" + options.getDebugName())
                .messages(messages)
                .userInitiatedRequest(false)
                .telemetryProperty("retryAfterFilterCategory", category)
                .enableRetryOnFilter(false)
                .enableRetryOnError(options.isRetryOnErrorEnabled())
                .build());
    }

    static String retryMessage(FilterReason category, String filteredContent) {
        if (category == FilterReason.COPYRIGHT) {
            return "The previous response (copied below) was filtered due to being too similar to existing public code. "
                    + "Please suggest something similar in function that does not match public code. "
                    + "Here's the previous response: " + filteredContent + "\n\n";
        }
        return "The previous response (copied below) was filtered due to triggering our content safety filters, "
                + "which looks for hateful, self-harm, sexual, or violent content. "
                + "Please suggest something similar in content that does not trigger these filters. "
                + "Here's the previous response: " + filteredContent + "\n\n";
    }

    /**
     * Builds the retry for a transport failure caused by a change of the local network: the same
     * request is sent once more through an alternate fetcher.
     *
     * @return the retry request, empty if the failure, the platform or the options do not allow it
     */
    public Optional<ChatFetchOptions> networkChangedRetryFor(ChatFetchOptions options, Throwable error) {
        if (!platform.retriesOnNetworkChange()
                || !options.isRetryOnErrorEnabled()
                || !fetcherService.isNetworkChangedError(error)) {
            return Optional.empty();
        }
        Optional<FetcherId> alternate = fetcherService.alternateTo(options.getUseFetcher().orElse(null));
        if (alternate.isEmpty()) {
            logger.debug("No alternate fetcher registered, not retrying '{}'", options.getDebugName());
            return Optional.empty();
        }

        logger.info("Retrying '{}' with {} after the network changed", options.getDebugName(), alternate.get());
        return Optional.of(options.toBuilder()
                .debugName("retry-error-" + options.getDebugName())
                .userInitiatedRequest(false)
                .telemetryProperty("retryAfterErrorCategory", NETWORK_CHANGED_CATEGORY)
                .enableRetryOnError(false)
                .useFetcher(alternate.get())
                .build());
    }
}
