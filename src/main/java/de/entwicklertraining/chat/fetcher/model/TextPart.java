package de.entwicklertraining.chat.fetcher.model;

import java.util.Objects;

public record TextPart(String text) implements ContentPart {
    public TextPart {
        Objects.requireNonNull(text, "text");
    }
}
