package de.entwicklertraining.chat.fetcher.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a sink so that failures are logged instead of reaching the request flow.
 */
public final class SafeTelemetrySink implements TelemetrySink {

    private static final Logger logger = LoggerFactory.getLogger(SafeTelemetrySink.class);

    private final TelemetrySink delegate;

    private SafeTelemetrySink(TelemetrySink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static TelemetrySink wrap(TelemetrySink delegate) {
        if (delegate instanceof SafeTelemetrySink) {
            return delegate;
        }
        return new SafeTelemetrySink(delegate);
    }

    @Override
    public void sendEvent(String eventName, TelemetryData data) {
        try {
            delegate.sendEvent(eventName, data);
        } catch (RuntimeException e) {
            logger.warn("Telemetry event '{}' could not be sent: {}", eventName, e.getMessage());
        }
    }
}
