package de.entwicklertraining.chat.fetcher.cancellation;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates and controls a {@link CancellationToken}.
 *
 * <pre>
 * CancellationTokenSource source = CancellationTokenSource.create(Duration.ofSeconds(30));
 * ChatResponse response = fetcher.fetchOne(options.toBuilder().cancellationToken(source.getToken()).build());
 * </pre>
 */
public final class CancellationTokenSource {

    private static final ScheduledExecutorService TIMEOUT_SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "chat-fetcher-cancellation-timer");
        thread.setDaemon(true);
        return thread;
    });

    private final CancellationToken token = new CancellationToken();

    private CancellationTokenSource() {
    }

    public static CancellationTokenSource create() {
        return new CancellationTokenSource();
    }

    /**
     * Creates a source whose token cancels itself once {@code timeout} has elapsed.
     */
    public static CancellationTokenSource create(Duration timeout) {
        CancellationTokenSource source = new CancellationTokenSource();
        TIMEOUT_SCHEDULER.schedule(source::cancel, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return source;
    }

    public CancellationToken getToken() {
        return token;
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
