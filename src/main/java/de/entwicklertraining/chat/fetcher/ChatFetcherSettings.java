package de.entwicklertraining.chat.fetcher;

import java.time.Clock;
import java.util.UUID;

/**
 * Settings for a {@link ChatFetcher}. All values have sensible defaults.
 * <p>
 * Example usage:
 * <pre>
 * ChatFetcherSettings settings = ChatFetcherSettings.builder()
 *     .defaultTemperature(0.2)
 *     .hardToolLimit(64)
 *     .build();
 * </pre>
 */
public final class ChatFetcherSettings {

    /** Temperature used when a request does not set one */
    private final double defaultTemperature;

    /** top_p used when a request does not set one */
    private final double defaultTopP;

    /** Maximum number of tools a single request may declare */
    private final int hardToolLimit;

    /** Sent as X-Interaction-Id with every request */
    private final String interactionId;

    /** Platform used to decide whether network-changed retries apply */
    private final Platform platform;

    private final Clock clock;

    private ChatFetcherSettings(Builder builder) {
        this.defaultTemperature = builder.defaultTemperature;
        this.defaultTopP = builder.defaultTopP;
        this.hardToolLimit = builder.hardToolLimit;
        this.interactionId = builder.interactionId;
        this.platform = builder.platform;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ChatFetcherSettings defaults() {
        return new Builder().build();
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     */
    public Builder toBuilder() {
        return new Builder()
                .defaultTemperature(defaultTemperature)
                .defaultTopP(defaultTopP)
                .hardToolLimit(hardToolLimit)
                .interactionId(interactionId)
                .platform(platform)
                .clock(clock);
    }

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public double getDefaultTopP() {
        return defaultTopP;
    }

    public int getHardToolLimit() {
        return hardToolLimit;
    }

    public String getInteractionId() {
        return interactionId;
    }

    public Platform getPlatform() {
        return platform;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private double defaultTemperature = 0.1;
        private double defaultTopP = 1;
        private int hardToolLimit = 128;
        private String interactionId = UUID.randomUUID().toString();
        private Platform platform = Platform.current();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder defaultTemperature(double defaultTemperature) {
            this.defaultTemperature = defaultTemperature;
            return this;
        }

        public Builder defaultTopP(double defaultTopP) {
            this.defaultTopP = defaultTopP;
            return this;
        }

        public Builder hardToolLimit(int hardToolLimit) {
            if (hardToolLimit < 1) {
                throw new IllegalArgumentException("hardToolLimit must be >= 1");
            }
            this.hardToolLimit = hardToolLimit;
            return this;
        }

        public Builder interactionId(String interactionId) {
            this.interactionId = interactionId;
            return this;
        }

        public Builder platform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ChatFetcherSettings build() {
            return new ChatFetcherSettings(this);
        }
    }
}
