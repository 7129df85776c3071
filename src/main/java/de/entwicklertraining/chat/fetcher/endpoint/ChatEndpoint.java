package de.entwicklertraining.chat.fetcher.endpoint;

import de.entwicklertraining.chat.fetcher.cancellation.CancellationToken;
import de.entwicklertraining.chat.fetcher.model.ChatCompletion;
import de.entwicklertraining.chat.fetcher.streaming.FinishedCallback;
import de.entwicklertraining.chat.fetcher.transport.FetchResponse;
import org.json.JSONObject;

import java.net.URI;
import java.util.List;

/**
 * A model deployment: where requests go, how the body is shaped and how the streamed response is
 * decoded.
 */
public interface ChatEndpoint {

    String getModel();

    URI getUrl();

    int getMaxOutputTokens();

    int getModelMaxPromptTokens();

    /**
     * Wire dialect of the endpoint, reported in telemetry.
     */
    String getApiType();

    boolean supportsVision();

    JSONObject createRequestBody(ChatEndpointRequest request);

    /**
     * Reads the streamed body of a successful response.
     *
     * @param response   the response, its body not yet consumed
     * @param expectedChoices number of candidates requested
     * @param callback   receives every delta in arrival order
     * @param token      cancels reading; the response is destroyed when it fires
     * @return one completion per candidate, ordered by candidate index
     * @throws de.entwicklertraining.chat.fetcher.cancellation.CancellationException if the token fired while reading
     * @throws de.entwicklertraining.chat.fetcher.transport.FetcherException if the stream broke
     */
    List<ChatCompletion> processResponse(FetchResponse response, int expectedChoices, FinishedCallback callback,
                                         CancellationToken token);

    Tokenizer acquireTokenizer();
}
