package de.entwicklertraining.chat.fetcher;

import de.entwicklertraining.chat.fetcher.model.ResponseDelta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FetchStreamRecorderTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(5_000), ZoneOffset.UTC);

    @Test
    @DisplayName("Deltas are recorded and forwarded together with the callback's answer")
    void testForwarding() {
        List<String> seen = new ArrayList<>();
        FetchStreamRecorder recorder = new FetchStreamRecorder((text, index, delta) -> {
            seen.add(text);
            return text.length() > 5 ? 5 : null;
        }, clock);

        assertNull(recorder.onDelta("Hel", 0, ResponseDelta.text("Hel")));
        assertEquals(5, recorder.onDelta("Hello world", 0, ResponseDelta.text("lo world")));

        assertEquals(List.of("Hel", "Hello world"), seen);
        assertEquals(2, recorder.getDeltas().size());
    }

    @Test
    @DisplayName("First token time is taken from the first non-empty text delta")
    void testFirstTokenTime() {
        FetchStreamRecorder recorder = new FetchStreamRecorder(null, clock);

        recorder.onDelta("", 0, ResponseDelta.thinking("hmm"));
        assertTrue(recorder.getFirstTokenEmittedTime().isEmpty());

        recorder.onDelta("a", 0, ResponseDelta.text("a"));
        assertEquals(5_000, recorder.getFirstTokenEmittedTime().getAsLong());
    }

    @Test
    @DisplayName("markRetry() emits a retry marker delta to the caller")
    void testMarkRetry() {
        List<ResponseDelta> forwarded = new ArrayList<>();
        FetchStreamRecorder recorder = new FetchStreamRecorder((text, index, delta) -> {
            forwarded.add(delta);
            return null;
        }, clock);

        recorder.markRetry("copyright");

        assertEquals(1, forwarded.size());
        assertTrue(forwarded.get(0).isRetryMarker());
        assertEquals("copyright", forwarded.get(0).retryReason());
        assertTrue(recorder.getFirstTokenEmittedTime().isEmpty());
    }
}
