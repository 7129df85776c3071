package de.entwicklertraining.chat.fetcher.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String properties and numeric measurements attached to one telemetry event.
 */
public final class TelemetryData {

    private final Map<String, String> properties = new LinkedHashMap<>();
    private final Map<String, Double> measurements = new LinkedHashMap<>();
    private final Instant issuedTime;

    private TelemetryData(Instant issuedTime) {
        this.issuedTime = issuedTime;
    }

    public static TelemetryData create() {
        return new TelemetryData(Instant.now());
    }

    public static TelemetryData create(Instant issuedTime) {
        return new TelemetryData(issuedTime);
    }

    /**
     * Adds a property. Null values are skipped.
     */
    public TelemetryData property(String name, String value) {
        if (value != null) {
            properties.put(name, value);
        }
        return this;
    }

    public TelemetryData properties(Map<String, String> values) {
        values.forEach(this::property);
        return this;
    }

    public TelemetryData measurement(String name, double value) {
        measurements.put(name, value);
        return this;
    }

    public Map<String, String> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, Double> getMeasurements() {
        return Collections.unmodifiableMap(measurements);
    }

    public Instant getIssuedTime() {
        return issuedTime;
    }

    @Override
    public String toString() {
        return "TelemetryData{properties=" + properties + ", measurements=" + measurements + "}";
    }
}
