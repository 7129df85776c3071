package de.entwicklertraining.chat.fetcher.telemetry;

/**
 * Receives fire-and-forget telemetry events. Implementations must not block.
 */
@FunctionalInterface
public interface TelemetrySink {

    TelemetrySink NO_OP = (eventName, data) -> { };

    void sendEvent(String eventName, TelemetryData data);
}
