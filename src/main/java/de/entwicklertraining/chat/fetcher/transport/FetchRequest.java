package de.entwicklertraining.chat.fetcher.transport;

import java.net.URI;
import java.util.Map;

/**
 * A POST request with a JSON body.
 */
public record FetchRequest(URI uri, Map<String, String> headers, String body) {

    public FetchRequest {
        headers = Map.copyOf(headers);
    }
}
