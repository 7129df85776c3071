package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import org.json.JSONObject;

import java.util.List;

/**
 * Records chat requests for later inspection.
 */
public interface RequestLogger {

    RequestLogger NO_OP = (debugName, model, body) -> PendingLoggedChatRequest.NO_OP;

    /**
     * Called before the request is sent.
     *
     * @param debugName name of the calling feature
     * @param model     model the request goes to
     * @param body      the request body, null if the request was rejected before it was built
     */
    PendingLoggedChatRequest begin(String debugName, String model, JSONObject body);

    /**
     * Handle for one logged request. Exactly one of the resolve methods is called per request.
     */
    interface PendingLoggedChatRequest {

        PendingLoggedChatRequest NO_OP = new PendingLoggedChatRequest() {
            @Override
            public void resolve(ChatResponse response, List<ResponseDelta> deltas) {
            }

            @Override
            public void resolveCancelled() {
            }
        };

        void resolve(ChatResponse response, List<ResponseDelta> deltas);

        void resolveCancelled();

        default void markTimeToFirstToken(long millis) {
        }
    }
}
