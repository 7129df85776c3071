package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import de.entwicklertraining.chat.fetcher.streaming.FinishedCallback;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Records every delta of one request and forwards it to the caller's callback.
 *
 * <p>Also remembers when the first non-empty text was handed to the caller so that
 * time-to-first-token can be reported.
 */
public class FetchStreamRecorder implements FinishedCallback {

    private final FinishedCallback delegate;
    private final Clock clock;
    private final List<ResponseDelta> deltas = Collections.synchronizedList(new ArrayList<>());
    private volatile long firstTokenEmittedTime = -1;

    public FetchStreamRecorder(FinishedCallback delegate, Clock clock) {
        this.delegate = delegate;
        this.clock = clock;
    }

    @Override
    public Integer onDelta(String text, int index, ResponseDelta delta) {
        if (firstTokenEmittedTime < 0 && delta.text() != null && !delta.text().isEmpty()) {
            firstTokenEmittedTime = clock.millis();
        }
        deltas.add(delta);
        return delegate != null ? delegate.onDelta(text, index, delta) : null;
    }

    /**
     * Emits the marker delta that precedes an automatic retry.
     */
    public void markRetry(String retryReason) {
        onDelta("", 0, ResponseDelta.retry(retryReason));
    }

    public List<ResponseDelta> getDeltas() {
        synchronized (deltas) {
            return List.copyOf(deltas);
        }
    }

    /**
     * Epoch millis at which the first text was emitted, empty if none was.
     */
    public OptionalLong getFirstTokenEmittedTime() {
        return firstTokenEmittedTime < 0 ? OptionalLong.empty() : OptionalLong.of(firstTokenEmittedTime);
    }
}
