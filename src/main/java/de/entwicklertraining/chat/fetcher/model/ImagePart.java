package de.entwicklertraining.chat.fetcher.model;

import java.util.Objects;

/**
 * An image reference, sent as an {@code image_url} part.
 *
 * @param url    http(s) or data URL of the image
 * @param detail optional detail hint ({@code low}, {@code high}, {@code auto}), may be null
 */
public record ImagePart(String url, String detail) implements ContentPart {
    public ImagePart {
        Objects.requireNonNull(url, "url");
    }
}
